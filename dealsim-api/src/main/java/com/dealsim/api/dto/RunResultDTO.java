package com.dealsim.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * One run with its outcome, as listed in queue results.
 */
@Data
public class RunResultDTO {

    private Long runId;
    private Long queueId;
    private Integer runNumber;
    private Integer executionOrder;
    private Long techniqueId;
    private Long tacticId;
    private String personalityId;
    private String zopaDistance;
    private String status;
    private String outcome;
    private String outcomeReason;
    private Integer totalRounds;
    private Integer retryCount;
    private String dealValue;
    private BigDecimal actualCost;
    private Map<String, Object> otherDimensions;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
}
