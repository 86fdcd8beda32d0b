package com.dealsim.domain.queue.model.valobj;

import com.dealsim.types.enums.SimulationEventTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Lifecycle event fanned out to listeners. Not persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationEvent {

    private SimulationEventTypeEnum type;

    private Long queueId;

    private Long negotiationId;

    private Map<String, Object> data;

    private LocalDateTime timestamp;
}
