package com.dealsim.api.dto;

import lombok.Data;

/**
 * Run statistics of a negotiation across all its queues.
 */
@Data
public class SimulationStatsDTO {

    private Long negotiationId;
    private Integer totalRuns;
    private Integer completedRuns;
    private Integer runningRuns;
    private Integer failedRuns;
    private Integer pendingRuns;
    /** percent, 0-100 */
    private Double successRate;
    private Boolean isPlanned;
}
