package com.dealsim.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * simulation_queue row
 *
 * @author dealsim
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationQueuePO {

    private Long id;

    private Long negotiationId;

    private Integer totalSimulations;

    private Integer priority;

    /**
     * pending / running / paused / completed / failed
     */
    private String status;

    private Integer completedCount;

    private Integer failedCount;

    private BigDecimal estimatedTotalCost;

    private BigDecimal actualTotalCost;

    private String lastError;

    /**
     * JSONB
     */
    private String metadata;

    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime pausedAt;

    private LocalDateTime completedAt;

    private LocalDateTime updatedAt;
}
