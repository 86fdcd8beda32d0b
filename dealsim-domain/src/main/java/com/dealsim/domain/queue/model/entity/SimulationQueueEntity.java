package com.dealsim.domain.queue.model.entity;

import com.dealsim.domain.queue.model.valobj.QueueRunStats;
import com.dealsim.types.enums.QueueStatusEnum;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Simulation queue aggregate: one batch of runs created from a single configuration.
 *
 * @author dealsim
 * @since 2026-03-02
 */
@Data
public class SimulationQueueEntity {

    /**
     * Primary key
     */
    private Long id;

    /**
     * Owning negotiation
     */
    private Long negotiationId;

    /**
     * Cross-product size fixed at creation
     */
    private Integer totalSimulations;

    private Integer priority;

    private QueueStatusEnum status;

    /**
     * Cached rollup, recomputed from run rows after every run transition
     */
    private Integer completedCount;

    /**
     * Cached rollup (failed + timeout runs)
     */
    private Integer failedCount;

    private BigDecimal estimatedTotalCost;

    private BigDecimal actualTotalCost;

    private String lastError;

    private Map<String, Object> metadata;

    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime pausedAt;

    private LocalDateTime completedAt;

    private LocalDateTime updatedAt;

    /**
     * Validates the queue before it is persisted.
     */
    public void validate() {
        if (negotiationId == null) {
            throw new IllegalStateException("Negotiation ID cannot be null");
        }
        if (totalSimulations == null || totalSimulations < 1) {
            throw new IllegalStateException("Total simulations must be positive");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
    }

    /**
     * First claim of a run moves the queue to RUNNING. Idempotent while running.
     */
    public void markRunning(LocalDateTime now) {
        if (this.status == QueueStatusEnum.RUNNING) {
            return;
        }
        if (this.status != QueueStatusEnum.PENDING && this.status != QueueStatusEnum.PAUSED) {
            throw new IllegalStateException("Queue must be PENDING or PAUSED to run, current: " + this.status);
        }
        this.status = QueueStatusEnum.RUNNING;
        if (this.startedAt == null) {
            this.startedAt = now;
        }
        this.pausedAt = null;
        this.updatedAt = now;
    }

    /**
     * Suspends dispatch. Idempotent while paused.
     */
    public void pause(LocalDateTime now) {
        if (this.status == QueueStatusEnum.PAUSED) {
            return;
        }
        if (!this.status.isActive()) {
            throw new IllegalStateException("Only PENDING or RUNNING queues can be paused, current: " + this.status);
        }
        this.status = QueueStatusEnum.PAUSED;
        this.pausedAt = now;
        this.updatedAt = now;
    }

    /**
     * Resumes dispatch of a paused queue.
     */
    public void resume(LocalDateTime now) {
        if (this.status == QueueStatusEnum.RUNNING) {
            return;
        }
        if (this.status != QueueStatusEnum.PAUSED) {
            throw new IllegalStateException("Only PAUSED queues can be resumed, current: " + this.status);
        }
        markRunning(now);
    }

    public void complete(LocalDateTime now) {
        this.status = QueueStatusEnum.COMPLETED;
        this.completedAt = now;
        this.pausedAt = null;
        this.updatedAt = now;
    }

    public void fail(String error, LocalDateTime now) {
        this.status = QueueStatusEnum.FAILED;
        this.lastError = error;
        this.completedAt = now;
        this.updatedAt = now;
    }

    /**
     * Puts the queue back in front of the scheduler. A running queue stays running.
     */
    public void rearm(LocalDateTime now) {
        if (this.status == QueueStatusEnum.RUNNING) {
            return;
        }
        this.status = QueueStatusEnum.PENDING;
        this.completedAt = null;
        this.pausedAt = null;
        this.lastError = null;
        this.updatedAt = now;
    }

    public void applyRollup(QueueRunStats stats) {
        if (stats == null) {
            return;
        }
        this.completedCount = stats.getCompletedCount();
        this.failedCount = stats.getFailedCount();
        this.actualTotalCost = stats.getTotalCost();
    }

    public boolean isDispatchable() {
        return this.status != null && this.status.isActive();
    }

    /**
     * Every run has reached a completed or failure-like status.
     */
    public boolean isFinished(QueueRunStats stats) {
        return stats != null && totalSimulations != null
                && stats.getCompletedCount() + stats.getFailedCount() >= totalSimulations;
    }
}
