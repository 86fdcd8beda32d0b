package com.dealsim.trigger.job;

import com.dealsim.domain.queue.adapter.repository.ISimulationQueueRepository;
import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.trigger.application.command.QueueStatusApplicationService;
import com.dealsim.types.enums.QueueStatusEnum;
import com.dealsim.types.enums.ResponseCode;
import com.dealsim.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Background processor. Every tick reaps stale runs, then starts one drain loop per active
 * queue that is not already draining. A queue is never drained by two loops at once.
 */
@Slf4j
@Component
public class SimulationQueueScheduler implements SmartLifecycle {

    private static final List<QueueStatusEnum> DISCOVERABLE = Arrays.asList(QueueStatusEnum.PENDING, QueueStatusEnum.RUNNING);

    private final TaskScheduler daemonScheduler;
    private final Executor drainWorker;
    private final SimulationRunExecutor simulationRunExecutor;
    private final StaleRunReaper staleRunReaper;
    private final ISimulationQueueRepository simulationQueueRepository;
    private final QueueStatusApplicationService queueStatusApplicationService;
    private final boolean enabled;
    private final long tickIntervalMs;
    private final long drainDelayMs;

    private final Set<Long> processingQueues = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Object lifecycleMonitor = new Object();
    private volatile ScheduledFuture<?> tickHandle;
    private volatile boolean stopping;

    public SimulationQueueScheduler(@Qualifier("daemonScheduler") TaskScheduler daemonScheduler,
                                    @Qualifier("simulationDrainWorker") Executor drainWorker,
                                    SimulationRunExecutor simulationRunExecutor,
                                    StaleRunReaper staleRunReaper,
                                    ISimulationQueueRepository simulationQueueRepository,
                                    QueueStatusApplicationService queueStatusApplicationService,
                                    @Value("${simulation.scheduler.enabled:true}") boolean enabled,
                                    @Value("${simulation.scheduler.tick-interval-ms:2000}") long tickIntervalMs,
                                    @Value("${simulation.scheduler.drain-delay-ms:1000}") long drainDelayMs) {
        this.daemonScheduler = daemonScheduler;
        this.drainWorker = drainWorker;
        this.simulationRunExecutor = simulationRunExecutor;
        this.staleRunReaper = staleRunReaper;
        this.simulationQueueRepository = simulationQueueRepository;
        this.queueStatusApplicationService = queueStatusApplicationService;
        this.enabled = enabled;
        this.tickIntervalMs = tickIntervalMs > 0 ? tickIntervalMs : 2000L;
        this.drainDelayMs = Math.max(drainDelayMs, 0L);
    }

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (tickHandle != null) {
                return;
            }
            stopping = false;
            tickHandle = daemonScheduler.scheduleWithFixedDelay(this::tick, Duration.ofMillis(tickIntervalMs));
            log.info("Simulation scheduler started. tickIntervalMs={}, drainDelayMs={}", tickIntervalMs, drainDelayMs);
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            stopping = true;
            if (tickHandle != null) {
                tickHandle.cancel(false);
                tickHandle = null;
            }
            log.info("Simulation scheduler stopped. inFlightQueues={}", getProcessingQueueIds());
        }
    }

    @Override
    public boolean isRunning() {
        return tickHandle != null;
    }

    @Override
    public boolean isAutoStartup() {
        return enabled;
    }

    /**
     * One discovery pass.
     */
    public void tick() {
        try {
            staleRunReaper.reapStaleRuns();
        } catch (Exception ex) {
            log.warn("Stale run reaping failed. error={}", ex.getMessage());
        }
        List<SimulationQueueEntity> queues = simulationQueueRepository.findByStatuses(DISCOVERABLE);
        if (queues == null || queues.isEmpty()) {
            return;
        }
        for (SimulationQueueEntity queue : queues) {
            if (queue != null && queue.getId() != null) {
                ensureDraining(queue.getId());
            }
        }
    }

    /**
     * Starts a drain loop for the queue unless one is already in flight.
     *
     * @return true when a new loop was started
     */
    public boolean ensureDraining(Long queueId) {
        if (queueId == null || stopping) {
            return false;
        }
        if (!processingQueues.add(queueId)) {
            return false;
        }
        try {
            drainWorker.execute(() -> drain(queueId));
        } catch (RejectedExecutionException ex) {
            processingQueues.remove(queueId);
            log.warn("Drain loop rejected, retrying next tick. queueId={}, error={}", queueId, ex.getMessage());
            return false;
        }
        log.debug("Drain loop started. queueId={}", queueId);
        return true;
    }

    /**
     * Runs a single {@code executeNext} under the same guard as the drain loops.
     */
    public boolean executeOnce(Long queueId) {
        if (!processingQueues.add(queueId)) {
            throw new AppException(ResponseCode.ILLEGAL_STATE.getCode(), "Queue is already being processed: " + queueId);
        }
        try {
            return simulationRunExecutor.executeNext(queueId);
        } finally {
            processingQueues.remove(queueId);
        }
    }

    public List<Long> getProcessingQueueIds() {
        synchronized (processingQueues) {
            return new ArrayList<>(processingQueues);
        }
    }

    /**
     * Forgets every in-flight id. Loops that are still running keep going.
     */
    public int resetProcessingQueues() {
        int cleared;
        synchronized (processingQueues) {
            cleared = processingQueues.size();
            processingQueues.clear();
        }
        log.warn("Processing queue set reset. cleared={}", cleared);
        return cleared;
    }

    private void drain(Long queueId) {
        try {
            while (!stopping) {
                if (!simulationRunExecutor.executeNext(queueId)) {
                    break;
                }
                if (drainDelayMs > 0) {
                    Thread.sleep(drainDelayMs);
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("Drain loop interrupted. queueId={}", queueId);
        } catch (Exception ex) {
            log.error("Drain loop crashed, marking queue failed. queueId={}, error={}", queueId, ex.getMessage(), ex);
            markFailed(queueId, ex);
        } finally {
            processingQueues.remove(queueId);
        }
    }

    private void markFailed(Long queueId, Exception cause) {
        try {
            queueStatusApplicationService.updateQueueStatus(queueId, QueueStatusEnum.FAILED, cause.getMessage());
        } catch (Exception ex) {
            log.warn("Failed to mark queue failed. queueId={}, error={}", queueId, ex.getMessage());
        }
    }
}
