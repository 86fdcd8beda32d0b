package com.dealsim.api.dto;

import lombok.Data;

import java.util.List;

/**
 * Background processor state.
 */
@Data
public class SystemStatusDTO {

    private Boolean backgroundProcessorRunning;
    private Integer activeQueues;
    private Integer processingQueuesCount;
    private List<Long> processingQueues;
    private List<QueueSummaryDTO> queues;
}
