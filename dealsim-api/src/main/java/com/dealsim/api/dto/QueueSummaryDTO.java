package com.dealsim.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Queue list item.
 */
@Data
public class QueueSummaryDTO {

    private Long queueId;
    private Long negotiationId;
    private String status;
    private Integer totalSimulations;
    private Integer completedCount;
    private Integer failedCount;
    private BigDecimal estimatedTotalCost;
    private BigDecimal actualTotalCost;
    private String lastError;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
}
