package com.dealsim.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome reported by the negotiation engine for a single run.
 *
 * @author dealsim
 * @since 2026-03-02
 */
public enum NegotiationOutcomeEnum {

    DEAL_ACCEPTED("DEAL_ACCEPTED", RunStatusEnum.COMPLETED, true),
    TERMINATED("TERMINATED", RunStatusEnum.COMPLETED, true),
    WALK_AWAY("WALK_AWAY", RunStatusEnum.COMPLETED, true),
    PAUSED("PAUSED", RunStatusEnum.PAUSED, false),
    MAX_ROUNDS_REACHED("MAX_ROUNDS_REACHED", RunStatusEnum.TIMEOUT, true),

    /**
     * Engine error, or any label this service does not recognize
     */
    ERROR("ERROR", RunStatusEnum.FAILED, false);

    private final String code;
    private final RunStatusEnum runStatus;
    private final boolean evaluable;

    NegotiationOutcomeEnum(String code, RunStatusEnum runStatus, boolean evaluable) {
        this.code = code;
        this.runStatus = runStatus;
        this.evaluable = evaluable;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Terminal run status this outcome classifies into.
     */
    public RunStatusEnum toRunStatus() {
        return runStatus;
    }

    /**
     * Whether the downstream evaluation hook should run for this outcome.
     */
    public boolean isEvaluable() {
        return evaluable;
    }

    public static NegotiationOutcomeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (NegotiationOutcomeEnum outcome : NegotiationOutcomeEnum.values()) {
            if (outcome.code.equals(code)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown negotiation outcome code: " + code);
    }

    /**
     * Lenient parse used at the engine boundary: unrecognized labels become {@link #ERROR}.
     */
    public static NegotiationOutcomeEnum resolve(String code) {
        if (code == null || code.isBlank()) {
            return ERROR;
        }
        String normalized = code.trim().toUpperCase();
        for (NegotiationOutcomeEnum outcome : NegotiationOutcomeEnum.values()) {
            if (outcome.code.equals(normalized)) {
                return outcome;
            }
        }
        return ERROR;
    }
}
