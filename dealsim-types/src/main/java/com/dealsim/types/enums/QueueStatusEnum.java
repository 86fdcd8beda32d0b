package com.dealsim.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Simulation queue status.
 *
 * @author dealsim
 * @since 2026-03-02
 */
public enum QueueStatusEnum {

    /**
     * Created or re-armed, waiting for the scheduler to pick it up
     */
    PENDING("pending"),

    /**
     * A drain loop is dispatching runs
     */
    RUNNING("running"),

    /**
     * Dispatch suspended by an operator
     */
    PAUSED("paused"),

    /**
     * Nothing left to dispatch, or stopped
     */
    COMPLETED("completed"),

    /**
     * Drain loop crashed
     */
    FAILED("failed");

    private final String code;

    QueueStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Pending or running queues are picked up by the scheduler tick.
     */
    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static QueueStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (QueueStatusEnum status : QueueStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown queue status code: " + code);
    }
}
