package com.dealsim.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Simulation run status.
 *
 * @author dealsim
 * @since 2026-03-02
 */
public enum RunStatusEnum {

    /**
     * Waiting to be claimed
     */
    PENDING("pending"),

    /**
     * Claimed and dispatched to the negotiation engine
     */
    RUNNING("running"),

    /**
     * Agreement reached, explicitly terminated or walked away
     */
    COMPLETED("completed"),

    /**
     * Retries exhausted or unrecognized outcome
     */
    FAILED("failed"),

    /**
     * Rounds exhausted, or reaped as stale
     */
    TIMEOUT("timeout"),

    /**
     * Engine reported a pause signal
     */
    PAUSED("paused"),

    /**
     * Stopped by an operator
     */
    ABORTED("aborted");

    private final String code;

    RunStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Whether a run in this status may move to {@code target}.
     */
    public boolean canTransitionTo(RunStatusEnum target) {
        if (target == null) {
            return false;
        }
        switch (this) {
            case PENDING:
                return target == RUNNING || target == ABORTED;
            case RUNNING:
                return target != RUNNING;
            case FAILED:
            case TIMEOUT:
                return target == PENDING;
            case PAUSED:
            case ABORTED:
            case COMPLETED:
                // single-run restart only
                return target == PENDING;
            default:
                return false;
        }
    }

    /**
     * Counted as failed in queue rollups.
     */
    public boolean isFailureLike() {
        return this == FAILED || this == TIMEOUT;
    }

    /**
     * Eligible for restart-failed and selective retry.
     */
    public boolean isRestartable() {
        return this == FAILED || this == TIMEOUT;
    }

    public static RunStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (RunStatusEnum status : RunStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status code: " + code);
    }
}
