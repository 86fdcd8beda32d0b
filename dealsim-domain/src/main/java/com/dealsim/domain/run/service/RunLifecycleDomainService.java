package com.dealsim.domain.run.service;

import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.domain.run.model.valobj.NegotiationResult;
import com.dealsim.types.enums.NegotiationOutcomeEnum;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * Run lifecycle decisions: outcome classification, cost model and fault handling.
 */
@Service
public class RunLifecycleDomainService {

    /**
     * Classifies an engine result onto the run. Unknown outcomes become FAILED.
     */
    public NegotiationOutcomeEnum applyResult(SimulationRunEntity run,
                                              NegotiationResult result,
                                              BigDecimal costPerRound,
                                              LocalDateTime now) {
        NegotiationOutcomeEnum outcome = result.getOutcome() != null
                ? result.getOutcome() : NegotiationOutcomeEnum.resolve(result.getRawOutcome());
        result.setOutcome(outcome);
        if (result.getRawOutcome() == null) {
            result.setRawOutcome(outcome.getCode());
        }
        run.applyResult(result, cost(result.roundsOrZero(), costPerRound), now);
        return outcome;
    }

    public BigDecimal cost(int rounds, BigDecimal costPerRound) {
        return costPerRound.multiply(BigDecimal.valueOf(rounds)).setScale(4, RoundingMode.HALF_UP);
    }

    public FaultDecision applyFault(SimulationRunEntity run, Throwable error, LocalDateTime now) {
        String message = error == null ? "unknown error" : error.getMessage();
        if (message == null) {
            message = error.getClass().getSimpleName();
        }
        return run.registerFault(message, now) ? FaultDecision.FAILED : FaultDecision.RETRY;
    }

    public enum FaultDecision {
        /**
         * Back to pending for another attempt
         */
        RETRY,
        /**
         * Retry budget exhausted
         */
        FAILED
    }
}
