package com.dealsim.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle events broadcast to listeners.
 */
public enum SimulationEventTypeEnum {

    SIMULATION_STARTED("simulation_started"),
    SIMULATION_COMPLETED("simulation_completed"),
    SIMULATION_FAILED("simulation_failed"),
    SIMULATION_STOPPED("simulation_stopped"),
    QUEUE_PROGRESS("queue_progress"),
    QUEUE_COMPLETED("queue_completed"),
    NEGOTIATION_ROUND("negotiation_round");

    private final String eventName;

    SimulationEventTypeEnum(String eventName) {
        this.eventName = eventName;
    }

    @JsonValue
    public String getEventName() {
        return eventName;
    }

    public static SimulationEventTypeEnum fromEventName(String eventName) {
        if (eventName == null) {
            return null;
        }
        for (SimulationEventTypeEnum type : SimulationEventTypeEnum.values()) {
            if (type.eventName.equals(eventName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown simulation event type: " + eventName);
    }
}
