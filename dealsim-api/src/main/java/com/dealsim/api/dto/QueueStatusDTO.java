package com.dealsim.api.dto;

import lombok.Data;

import java.math.BigDecimal;

/**
 * Queue progress snapshot.
 */
@Data
public class QueueStatusDTO {

    private Long queueId;
    private Long negotiationId;
    private String status;
    private Integer totalSimulations;
    private Integer completedCount;
    private Integer failedCount;
    private Integer pendingCount;
    private Integer runningCount;
    private Integer pausedCount;
    private Integer abortedCount;
    private Integer progressPercentage;
    /** seconds */
    private Long estimatedTimeRemaining;
    private CurrentRunDTO currentSimulation;
    private BigDecimal actualCost;
    private BigDecimal estimatedCost;
}
