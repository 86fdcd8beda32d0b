package com.dealsim.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * simulation_runs row
 *
 * @author dealsim
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationRunPO {

    private Long id;

    private Long queueId;

    private Long negotiationId;

    private Integer runNumber;

    private Integer executionOrder;

    private Long techniqueId;

    private Long tacticId;

    private String personalityId;

    private String zopaDistance;

    private String status;

    private Integer retryCount;

    private Integer maxRetries;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    /**
     * JSONB array
     */
    private String conversationLog;

    /**
     * JSONB
     */
    private String otherDimensions;

    private String dealValue;

    private BigDecimal actualCost;

    private String outcome;

    private String outcomeReason;

    private Integer totalRounds;

    /**
     * JSONB
     */
    private String metadata;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
