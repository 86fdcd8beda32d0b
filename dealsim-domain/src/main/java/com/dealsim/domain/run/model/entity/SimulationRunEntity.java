package com.dealsim.domain.run.model.entity;

import com.dealsim.domain.run.model.valobj.NegotiationResult;
import com.dealsim.types.enums.RunStatusEnum;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One negotiation simulation inside a queue.
 *
 * @author dealsim
 * @since 2026-03-02
 */
@Data
public class SimulationRunEntity {

    public static final String META_CHECKPOINT = "checkpoint";
    public static final String META_LAST_ERROR = "lastError";
    public static final String META_ANALYTICS_ERROR = "analyticsError";
    public static final String META_ABORTED_FROM = "abortedFrom";

    /**
     * Primary key
     */
    private Long id;

    private Long queueId;

    private Long negotiationId;

    /**
     * Same value as executionOrder
     */
    private Integer runNumber;

    /**
     * 1..N, strictly increasing inside a queue
     */
    private Integer executionOrder;

    private Long techniqueId;

    private Long tacticId;

    private String personalityId;

    private String zopaDistance;

    private RunStatusEnum status;

    private Integer retryCount;

    private Integer maxRetries;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private List<Map<String, Object>> conversationLog;

    private Map<String, Object> otherDimensions;

    /**
     * Decimal string with two places, null when no product price was found
     */
    private String dealValue;

    private BigDecimal actualCost;

    /**
     * Raw outcome label as reported by the engine
     */
    private String outcome;

    private String outcomeReason;

    private Integer totalRounds;

    private Map<String, Object> metadata;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * Validates the run before it is persisted.
     */
    public void validate() {
        if (queueId == null) {
            throw new IllegalStateException("Queue ID cannot be null");
        }
        if (executionOrder == null || executionOrder < 1) {
            throw new IllegalStateException("Execution order must be positive");
        }
        if (techniqueId == null || tacticId == null) {
            throw new IllegalStateException("Technique and tactic cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
    }

    /**
     * Claim for dispatch. Stores a crash checkpoint in metadata.
     */
    public void claim(LocalDateTime now) {
        transitionTo(RunStatusEnum.RUNNING);
        this.startedAt = now;
        this.completedAt = null;
        Map<String, Object> checkpoint = new LinkedHashMap<>();
        checkpoint.put("simulationId", id);
        checkpoint.put("queueId", queueId);
        checkpoint.put("startTime", now == null ? null : now.toString());
        checkpoint.put("round", 0);
        ensureMetadata().put(META_CHECKPOINT, checkpoint);
        this.updatedAt = now;
    }

    /**
     * Applies a classified engine result. The checkpoint is dropped.
     */
    public void applyResult(NegotiationResult result, BigDecimal cost, LocalDateTime now) {
        transitionTo(result.getOutcome().toRunStatus());
        this.completedAt = now;
        this.outcome = result.getRawOutcome();
        this.outcomeReason = result.getOutcomeReason();
        this.totalRounds = result.getTotalRounds();
        this.conversationLog = result.getConversationLog() == null
                ? new ArrayList<>() : new ArrayList<>(result.getConversationLog());
        this.actualCost = cost;
        ensureMetadata().remove(META_CHECKPOINT);
        this.updatedAt = now;
    }

    public void applyArtifacts(String dealValue, Map<String, Object> otherDimensions) {
        this.dealValue = dealValue;
        this.otherDimensions = otherDimensions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(otherDimensions);
    }

    /**
     * Result processing failure. Status stays untouched.
     */
    public void recordAnalyticsError(String error, LocalDateTime now) {
        Map<String, Object> meta = ensureMetadata();
        meta.put(META_ANALYTICS_ERROR, error);
        meta.put("analyticsErrorAt", now == null ? null : now.toString());
    }

    /**
     * Registers an engine fault.
     *
     * @return true when retries are exhausted and the run became FAILED
     */
    public boolean registerFault(String error, LocalDateTime now) {
        int attempts = (retryCount == null ? 0 : retryCount) + 1;
        int limit = maxRetries == null ? 0 : maxRetries;
        this.retryCount = attempts;
        Map<String, Object> meta = ensureMetadata();
        meta.remove(META_CHECKPOINT);
        meta.put(META_LAST_ERROR, error);
        this.updatedAt = now;
        if (attempts >= limit) {
            transitionTo(RunStatusEnum.FAILED);
            this.completedAt = now;
            meta.put("finalRetry", true);
            meta.put("failedAt", now == null ? null : now.toString());
            return true;
        }
        transitionTo(RunStatusEnum.PENDING);
        this.startedAt = null;
        meta.put("retryAttempt", attempts);
        meta.put("lastRetryAt", now == null ? null : now.toString());
        return false;
    }

    public void markTimedOut(LocalDateTime now) {
        transitionTo(RunStatusEnum.TIMEOUT);
        this.completedAt = now;
        this.updatedAt = now;
    }

    /**
     * Records the status the run was aborted from, so a stop knows which runs were on the engine.
     */
    public void abort(LocalDateTime now) {
        RunStatusEnum previous = status;
        transitionTo(RunStatusEnum.ABORTED);
        this.completedAt = now;
        Map<String, Object> meta = ensureMetadata();
        meta.remove(META_CHECKPOINT);
        meta.put(META_ABORTED_FROM, previous == null ? null : previous.getCode());
        this.updatedAt = now;
    }

    public boolean wasAbortedWhileRunning() {
        return status == RunStatusEnum.ABORTED && metadata != null
                && RunStatusEnum.RUNNING.getCode().equals(metadata.get(META_ABORTED_FROM));
    }

    /**
     * Hands a claimed run back before it reached the engine. The retry budget is untouched.
     */
    public void releaseClaim(LocalDateTime now) {
        if (status != RunStatusEnum.RUNNING) {
            throw new IllegalStateException("Only RUNNING runs can be released, current: " + status);
        }
        transitionTo(RunStatusEnum.PENDING);
        this.startedAt = null;
        ensureMetadata().remove(META_CHECKPOINT);
        this.updatedAt = now;
    }

    /**
     * Failed or timed out run goes back to pending with a fresh retry budget.
     */
    public void resetForRestart(LocalDateTime now) {
        if (status == null || !status.isRestartable()) {
            throw new IllegalStateException("Only FAILED or TIMEOUT runs can be restarted, current: " + status);
        }
        transitionTo(RunStatusEnum.PENDING);
        this.actualCost = BigDecimal.ZERO;
        this.retryCount = 0;
        this.startedAt = null;
        this.completedAt = null;
        Map<String, Object> meta = ensureMetadata();
        meta.put("retried", true);
        meta.put("retriedAt", now == null ? null : now.toString());
        this.updatedAt = now;
    }

    /**
     * Any non-running run goes back to pending with its results cleared.
     */
    public void resetForSingleRestart(LocalDateTime now) {
        if (status == RunStatusEnum.RUNNING) {
            throw new IllegalStateException("Run is currently running: " + id);
        }
        if (status != RunStatusEnum.PENDING) {
            transitionTo(RunStatusEnum.PENDING);
        }
        this.startedAt = null;
        this.completedAt = null;
        this.conversationLog = new ArrayList<>();
        this.otherDimensions = new LinkedHashMap<>();
        this.dealValue = null;
        this.outcome = null;
        this.outcomeReason = null;
        this.totalRounds = 0;
        this.actualCost = BigDecimal.ZERO;
        this.retryCount = 0;
        Map<String, Object> meta = ensureMetadata();
        meta.remove(META_CHECKPOINT);
        meta.remove(META_LAST_ERROR);
        meta.remove(META_ANALYTICS_ERROR);
        meta.put("restartedAt", now == null ? null : now.toString());
        this.updatedAt = now;
    }

    /**
     * Orphaned running run handed back to the scheduler.
     */
    public void recoverOrphan(LocalDateTime now) {
        if (status != RunStatusEnum.RUNNING) {
            throw new IllegalStateException("Only RUNNING runs can be recovered, current: " + status);
        }
        transitionTo(RunStatusEnum.PENDING);
        this.startedAt = null;
        Map<String, Object> meta = ensureMetadata();
        meta.put("recovered", true);
        meta.put("recoveredAt", now == null ? null : now.toString());
        this.updatedAt = now;
    }

    public boolean isRunning() {
        return status == RunStatusEnum.RUNNING;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getCheckpoint() {
        if (metadata == null) {
            return null;
        }
        Object checkpoint = metadata.get(META_CHECKPOINT);
        return checkpoint instanceof Map ? (Map<String, Object>) checkpoint : null;
    }

    private void transitionTo(RunStatusEnum target) {
        if (this.status == null || !this.status.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal run transition: " + this.status + " -> " + target);
        }
        this.status = target;
    }

    private Map<String, Object> ensureMetadata() {
        if (metadata == null) {
            metadata = new HashMap<>();
        }
        return metadata;
    }
}
