package com.dealsim.domain.run.adapter.gateway;

import com.dealsim.domain.run.model.valobj.NegotiationRequest;
import com.dealsim.domain.run.model.valobj.NegotiationResult;
import com.dealsim.domain.run.model.valobj.RoundUpdate;

import java.util.function.Consumer;

/**
 * Port to the external negotiation engine.
 */
public interface INegotiationEngineGateway {

    /**
     * Runs one negotiation to its end. Round updates are delivered in emission order on the
     * calling thread or the gateway's own thread, never concurrently for the same run.
     *
     * @throws RuntimeException on any engine fault
     */
    NegotiationResult run(NegotiationRequest request, Consumer<RoundUpdate> roundListener);

    /**
     * Best-effort cancellation of an in-flight run.
     */
    default void cancel(Long runId) {
    }
}
