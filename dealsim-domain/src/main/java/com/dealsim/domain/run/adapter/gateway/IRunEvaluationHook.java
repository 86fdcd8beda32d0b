package com.dealsim.domain.run.adapter.gateway;

/**
 * Downstream evaluation of a finished run. Failures never affect the run.
 */
public interface IRunEvaluationHook {

    void evaluate(Long runId, Long negotiationId, String outcome);
}
