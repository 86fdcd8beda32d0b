package com.dealsim.domain.run.model.valobj;

import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of an atomic claim attempt.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RunClaimResult {

    public enum Kind {
        /**
         * A pending run was moved to RUNNING
         */
        CLAIMED,
        /**
         * No pending run left
         */
        NONE,
        /**
         * Another run of the queue is already running
         */
        AT_CAPACITY
    }

    private final Kind kind;

    private final SimulationRunEntity run;

    public static RunClaimResult claimed(SimulationRunEntity run) {
        return new RunClaimResult(Kind.CLAIMED, run);
    }

    public static RunClaimResult none() {
        return new RunClaimResult(Kind.NONE, null);
    }

    public static RunClaimResult atCapacity() {
        return new RunClaimResult(Kind.AT_CAPACITY, null);
    }

    public boolean isClaimed() {
        return kind == Kind.CLAIMED && run != null;
    }
}
