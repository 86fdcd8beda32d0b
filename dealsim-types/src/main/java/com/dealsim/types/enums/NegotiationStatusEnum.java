package com.dealsim.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of the negotiation that owns simulation queues.
 */
public enum NegotiationStatusEnum {

    PLANNED("planned"),
    RUNNING("running"),
    COMPLETED("completed"),
    ABORTED("aborted");

    private final String code;

    NegotiationStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Negotiation status mirrored from a queue status. Paused queues keep the
     * negotiation in {@code running}.
     */
    public static NegotiationStatusEnum fromQueueStatus(QueueStatusEnum queueStatus) {
        if (queueStatus == null) {
            return PLANNED;
        }
        switch (queueStatus) {
            case RUNNING:
            case PAUSED:
                return RUNNING;
            case COMPLETED:
                return COMPLETED;
            case FAILED:
                return ABORTED;
            default:
                return PLANNED;
        }
    }

    public static NegotiationStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (NegotiationStatusEnum status : NegotiationStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown negotiation status code: " + code);
    }
}
