package com.dealsim.trigger.application.command;

import com.dealsim.domain.negotiation.adapter.repository.INegotiationRepository;
import com.dealsim.domain.queue.adapter.repository.ISimulationQueueRepository;
import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.queue.model.valobj.QueueRunStats;
import com.dealsim.domain.run.adapter.repository.ISimulationRunRepository;
import com.dealsim.trigger.event.SimulationEventPublisher;
import com.dealsim.types.enums.NegotiationStatusEnum;
import com.dealsim.types.enums.QueueStatusEnum;
import com.dealsim.types.enums.ResponseCode;
import com.dealsim.types.enums.SimulationEventTypeEnum;
import com.dealsim.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queue status write use case: applies a queue transition, mirrors it onto the owning
 * negotiation, refreshes the cached rollup and emits progress or completion events.
 */
@Slf4j
@Service
public class QueueStatusApplicationService {

    private static final int REARM_ATTEMPTS = 3;

    private final ISimulationQueueRepository simulationQueueRepository;
    private final ISimulationRunRepository simulationRunRepository;
    private final INegotiationRepository negotiationRepository;
    private final SimulationEventPublisher simulationEventPublisher;

    public QueueStatusApplicationService(ISimulationQueueRepository simulationQueueRepository,
                                         ISimulationRunRepository simulationRunRepository,
                                         INegotiationRepository negotiationRepository,
                                         SimulationEventPublisher simulationEventPublisher) {
        this.simulationQueueRepository = simulationQueueRepository;
        this.simulationRunRepository = simulationRunRepository;
        this.negotiationRepository = negotiationRepository;
        this.simulationEventPublisher = simulationEventPublisher;
    }

    /**
     * Moves the queue to {@code target}. Illegal transitions surface as ILLEGAL_STATE.
     */
    public SimulationQueueEntity updateQueueStatus(Long queueId, QueueStatusEnum target, String error) {
        SimulationQueueEntity queue = simulationQueueRepository.findById(queueId);
        if (queue == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Queue not found: " + queueId);
        }
        return updateQueueStatus(queue, target, error);
    }

    public SimulationQueueEntity updateQueueStatus(SimulationQueueEntity queue, QueueStatusEnum target, String error) {
        SimulationQueueEntity updated = tryUpdateQueueStatus(queue, target, error);
        if (updated == null) {
            throw new AppException(ResponseCode.ILLEGAL_STATE.getCode(), "Queue status changed concurrently: " + queue.getId());
        }
        return updated;
    }

    /**
     * Applies the transition against the status held by {@code queue} and writes it only if the
     * stored status still matches.
     *
     * @return null when another writer moved the queue since it was read
     */
    public SimulationQueueEntity tryUpdateQueueStatus(SimulationQueueEntity queue, QueueStatusEnum target, String error) {
        if (queue.getStatus() == target && target != QueueStatusEnum.FAILED) {
            return queue;
        }
        QueueStatusEnum expected = queue.getStatus();
        LocalDateTime now = LocalDateTime.now();
        try {
            switch (target) {
                case RUNNING:
                    if (queue.getStatus() == QueueStatusEnum.PAUSED) {
                        queue.resume(now);
                    } else {
                        queue.markRunning(now);
                    }
                    break;
                case PAUSED:
                    queue.pause(now);
                    break;
                case COMPLETED:
                    queue.complete(now);
                    break;
                case FAILED:
                    queue.fail(error, now);
                    break;
                case PENDING:
                default:
                    queue.rearm(now);
                    break;
            }
        } catch (IllegalStateException ex) {
            throw new AppException(ResponseCode.ILLEGAL_STATE.getCode(), ex.getMessage());
        }
        if (!simulationQueueRepository.updateStatus(queue, expected)) {
            log.info("Queue status write lost to a concurrent writer. queueId={}, expected={}, target={}",
                    queue.getId(), expected, target);
            return null;
        }
        syncNegotiationStatus(queue);
        log.debug("Queue status updated. queueId={}, status={}", queue.getId(), queue.getStatus());
        return queue;
    }

    /**
     * Puts the queue back to PENDING after runs were reset. Re-reads on every attempt, and a
     * queue some other writer already re-armed counts as done.
     */
    public SimulationQueueEntity rearm(Long queueId) {
        for (int attempt = 0; attempt < REARM_ATTEMPTS; attempt++) {
            SimulationQueueEntity queue = simulationQueueRepository.findById(queueId);
            if (queue == null) {
                throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Queue not found: " + queueId);
            }
            SimulationQueueEntity updated = tryUpdateQueueStatus(queue, QueueStatusEnum.PENDING, null);
            if (updated != null) {
                return updated;
            }
        }
        throw new AppException(ResponseCode.ILLEGAL_STATE.getCode(), "Queue status changed concurrently: " + queueId);
    }

    /**
     * Recomputes the cached counters from the run rows.
     */
    public QueueRunStats refreshRollup(Long queueId) {
        QueueRunStats stats = simulationRunRepository.summarize(queueId);
        simulationQueueRepository.updateRollup(queueId, stats);
        return stats;
    }

    /**
     * Completes the queue once every run finished, otherwise broadcasts progress.
     *
     * @return true when the queue was completed by this call
     */
    public boolean publishProgressOrCompletion(Long queueId, QueueRunStats stats) {
        SimulationQueueEntity queue = simulationQueueRepository.findById(queueId);
        if (queue == null) {
            return false;
        }
        queue.applyRollup(stats);
        if (queue.isFinished(stats)) {
            if (queue.getStatus() != QueueStatusEnum.COMPLETED) {
                SimulationQueueEntity completed = tryUpdateQueueStatus(queue, QueueStatusEnum.COMPLETED, null);
                if (completed == null) {
                    return false;
                }
                queue = completed;
            }
            publishQueueCompleted(queue, stats, false);
            return true;
        }
        Map<String, Object> data = progressPayload(queue, stats);
        simulationEventPublisher.publish(SimulationEventTypeEnum.QUEUE_PROGRESS,
                queue.getId(), queue.getNegotiationId(), data);
        return false;
    }

    public void publishQueueCompleted(SimulationQueueEntity queue, QueueRunStats stats, boolean stopped) {
        Map<String, Object> data = progressPayload(queue, stats);
        if (stopped) {
            data.put("stopped", true);
        }
        simulationEventPublisher.publish(SimulationEventTypeEnum.QUEUE_COMPLETED,
                queue.getId(), queue.getNegotiationId(), data);
    }

    private Map<String, Object> progressPayload(SimulationQueueEntity queue, QueueRunStats stats) {
        int total = queue.getTotalSimulations() == null ? 0 : queue.getTotalSimulations();
        int completed = stats == null ? 0 : stats.getCompletedCount();
        int failed = stats == null ? 0 : stats.getFailedCount();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", queue.getStatus() == null ? null : queue.getStatus().getCode());
        data.put("completed", completed);
        data.put("failed", failed);
        data.put("total", total);
        data.put("progressPercentage", total > 0 ? (int) Math.round((completed + failed) * 100D / total) : 0);
        data.put("actualCost", stats == null ? null : stats.getTotalCost());
        return data;
    }

    private void syncNegotiationStatus(SimulationQueueEntity queue) {
        if (queue.getNegotiationId() == null) {
            return;
        }
        NegotiationStatusEnum target = NegotiationStatusEnum.fromQueueStatus(queue.getStatus());
        try {
            negotiationRepository.updateStatus(queue.getNegotiationId(), target);
        } catch (Exception ex) {
            log.warn("Failed to sync negotiation status. negotiationId={}, queueId={}, status={}, error={}",
                    queue.getNegotiationId(), queue.getId(), target.getCode(), ex.getMessage());
        }
    }
}
