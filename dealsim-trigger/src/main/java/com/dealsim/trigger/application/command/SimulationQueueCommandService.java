package com.dealsim.trigger.application.command;

import com.dealsim.domain.catalog.adapter.repository.IReferenceCatalogRepository;
import com.dealsim.domain.negotiation.adapter.repository.INegotiationRepository;
import com.dealsim.domain.negotiation.model.entity.NegotiationEntity;
import com.dealsim.domain.queue.adapter.repository.ISimulationQueueRepository;
import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.queue.model.valobj.QueueCreateCommand;
import com.dealsim.domain.queue.model.valobj.QueueRunStats;
import com.dealsim.domain.queue.service.RunMatrixDomainService;
import com.dealsim.domain.result.adapter.repository.IRunResultRepository;
import com.dealsim.domain.run.adapter.gateway.INegotiationEngineGateway;
import com.dealsim.domain.run.adapter.repository.ISimulationRunRepository;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.trigger.event.SimulationEventPublisher;
import com.dealsim.trigger.job.SimulationQueueScheduler;
import com.dealsim.types.enums.NegotiationStatusEnum;
import com.dealsim.types.enums.QueueStatusEnum;
import com.dealsim.types.enums.ResponseCode;
import com.dealsim.types.enums.RunStatusEnum;
import com.dealsim.types.enums.SimulationEventTypeEnum;
import com.dealsim.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Queue write use cases: create, start, pause, resume, stop and restart.
 */
@Slf4j
@Service
public class SimulationQueueCommandService {

    public static final String MODE_NEXT = "next";
    public static final String MODE_ALL = "all";

    private static final List<RunStatusEnum> RESTARTABLE = Arrays.asList(RunStatusEnum.FAILED, RunStatusEnum.TIMEOUT);
    private static final List<QueueStatusEnum> STOPPABLE = Arrays.asList(
            QueueStatusEnum.PENDING, QueueStatusEnum.RUNNING, QueueStatusEnum.PAUSED);

    private final ISimulationQueueRepository simulationQueueRepository;
    private final ISimulationRunRepository simulationRunRepository;
    private final IRunResultRepository runResultRepository;
    private final INegotiationRepository negotiationRepository;
    private final IReferenceCatalogRepository referenceCatalogRepository;
    private final INegotiationEngineGateway negotiationEngineGateway;
    private final RunMatrixDomainService runMatrixDomainService;
    private final QueueStatusApplicationService queueStatusApplicationService;
    private final SimulationEventPublisher simulationEventPublisher;
    private final SimulationQueueScheduler simulationQueueScheduler;
    private final BigDecimal costPerRun;
    private final int defaultMaxRetries;
    private final String defaultPersonality;
    private final String defaultDistance;

    public SimulationQueueCommandService(ISimulationQueueRepository simulationQueueRepository,
                                         ISimulationRunRepository simulationRunRepository,
                                         IRunResultRepository runResultRepository,
                                         INegotiationRepository negotiationRepository,
                                         IReferenceCatalogRepository referenceCatalogRepository,
                                         INegotiationEngineGateway negotiationEngineGateway,
                                         RunMatrixDomainService runMatrixDomainService,
                                         QueueStatusApplicationService queueStatusApplicationService,
                                         SimulationEventPublisher simulationEventPublisher,
                                         SimulationQueueScheduler simulationQueueScheduler,
                                         @Value("${simulation.queue.cost-per-run:0.15}") BigDecimal costPerRun,
                                         @Value("${simulation.executor.default-max-retries:3}") int defaultMaxRetries,
                                         @Value("${simulation.queue.default-personality:default}") String defaultPersonality,
                                         @Value("${simulation.queue.default-distance:medium}") String defaultDistance) {
        this.simulationQueueRepository = simulationQueueRepository;
        this.simulationRunRepository = simulationRunRepository;
        this.runResultRepository = runResultRepository;
        this.negotiationRepository = negotiationRepository;
        this.referenceCatalogRepository = referenceCatalogRepository;
        this.negotiationEngineGateway = negotiationEngineGateway;
        this.runMatrixDomainService = runMatrixDomainService;
        this.queueStatusApplicationService = queueStatusApplicationService;
        this.simulationEventPublisher = simulationEventPublisher;
        this.simulationQueueScheduler = simulationQueueScheduler;
        this.costPerRun = costPerRun == null ? new BigDecimal("0.15") : costPerRun;
        this.defaultMaxRetries = defaultMaxRetries > 0 ? defaultMaxRetries : 3;
        this.defaultPersonality = defaultPersonality;
        this.defaultDistance = defaultDistance;
    }

    /**
     * Expands the configuration into a pending queue. An active queue of the same negotiation
     * is returned instead of creating a second one.
     */
    @Transactional(rollbackFor = Exception.class)
    public SimulationQueueEntity createQueue(QueueCreateCommand command) {
        if (command == null || command.getNegotiationId() == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "negotiationId must not be null");
        }
        List<Long> techniques = distinct(command.getTechniqueIds());
        List<Long> tactics = distinct(command.getTacticIds());
        if (techniques.isEmpty() || tactics.isEmpty()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                    "At least one technique and one tactic are required");
        }
        Long negotiationId = command.getNegotiationId();
        NegotiationEntity negotiation = negotiationRepository.findById(negotiationId);
        if (negotiation == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Negotiation not found: " + negotiationId);
        }

        SimulationQueueEntity existing = simulationQueueRepository.findActiveByNegotiationId(negotiationId);
        if (existing != null) {
            log.info("Active queue reused. negotiationId={}, queueId={}", negotiationId, existing.getId());
            return existing;
        }

        List<String> personalities = runMatrixDomainService.resolvePersonalities(command.getPersonalitySelector(),
                referenceCatalogRepository.findAllPersonalityIds(), defaultPersonality);
        List<String> distances = runMatrixDomainService.resolveDistances(command.getDistanceSelector(), defaultDistance);
        int total = runMatrixDomainService.matrixSize(techniques, tactics, personalities, distances);

        SimulationQueueEntity queue = simulationQueueRepository.save(
                runMatrixDomainService.buildQueue(negotiationId, total, costPerRun, LocalDateTime.now()));
        simulationRunRepository.batchSave(runMatrixDomainService.buildRuns(queue, techniques, tactics,
                personalities, distances, defaultMaxRetries));
        negotiationRepository.updateStatus(negotiationId, NegotiationStatusEnum.PLANNED);
        log.info("Simulation queue created. negotiationId={}, queueId={}, totalSimulations={}, techniques={}, tactics={}, personalities={}, distances={}",
                negotiationId, queue.getId(), total, techniques.size(), tactics.size(), personalities.size(), distances.size());
        return queue;
    }

    public SimulationQueueEntity startQueue(Long queueId) {
        SimulationQueueEntity queue = requireQueue(queueId);
        if (simulationRunRepository.summarize(queueId).getPendingCount() == 0) {
            throw new AppException(ResponseCode.ILLEGAL_STATE.getCode(), "Queue has no pending simulations: " + queueId);
        }
        if (queue.getStatus() != QueueStatusEnum.RUNNING) {
            queue = queueStatusApplicationService.updateQueueStatus(queue, QueueStatusEnum.PENDING, null);
        }
        simulationQueueScheduler.ensureDraining(queueId);
        log.info("Queue started. queueId={}, status={}", queueId, queue.getStatus());
        return queue;
    }

    public SimulationQueueEntity pauseQueue(Long queueId) {
        SimulationQueueEntity queue = queueStatusApplicationService.updateQueueStatus(requireQueue(queueId),
                QueueStatusEnum.PAUSED, null);
        log.info("Queue paused. queueId={}", queueId);
        return queue;
    }

    public SimulationQueueEntity resumeQueue(Long queueId) {
        SimulationQueueEntity queue = queueStatusApplicationService.updateQueueStatus(requireQueue(queueId),
                QueueStatusEnum.RUNNING, null);
        simulationQueueScheduler.ensureDraining(queueId);
        log.info("Queue resumed. queueId={}", queueId);
        return queue;
    }

    /**
     * Aborts every pending or running run and completes the queue.
     *
     * @return number of aborted runs
     */
    public int stopQueue(Long queueId) {
        requireQueue(queueId);
        List<SimulationRunEntity> aborted = simulationRunRepository.abortActive(queueId, LocalDateTime.now());
        int cancelled = 0;
        for (SimulationRunEntity run : aborted) {
            if (!run.wasAbortedWhileRunning()) {
                continue;
            }
            cancelled++;
            try {
                negotiationEngineGateway.cancel(run.getId());
            } catch (Exception ex) {
                log.warn("Engine cancel failed. queueId={}, runId={}, error={}", queueId, run.getId(), ex.getMessage());
            }
        }

        QueueRunStats stats = queueStatusApplicationService.refreshRollup(queueId);
        SimulationQueueEntity queue = queueStatusApplicationService.updateQueueStatus(queueId, QueueStatusEnum.COMPLETED, null);
        for (SimulationRunEntity run : aborted) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("simulationId", run.getId());
            data.put("runNumber", run.getRunNumber());
            data.put("reason", "manually_stopped");
            simulationEventPublisher.publish(SimulationEventTypeEnum.SIMULATION_STOPPED, queueId, queue.getNegotiationId(), data);
        }
        queueStatusApplicationService.publishQueueCompleted(queue, stats, true);
        log.info("Queue stopped. queueId={}, abortedRuns={}, cancelledRuns={}", queueId, aborted.size(), cancelled);
        return aborted.size();
    }

    /**
     * @return number of queues stopped
     */
    public int stopQueuesForNegotiation(Long negotiationId) {
        List<SimulationQueueEntity> queues = simulationQueueRepository.findByNegotiationId(negotiationId);
        int stopped = 0;
        for (SimulationQueueEntity queue : queues) {
            if (queue.getStatus() == null || !STOPPABLE.contains(queue.getStatus())) {
                continue;
            }
            try {
                stopQueue(queue.getId());
                stopped++;
            } catch (Exception ex) {
                log.warn("Failed to stop queue. negotiationId={}, queueId={}, error={}",
                        negotiationId, queue.getId(), ex.getMessage());
            }
        }
        return stopped;
    }

    /**
     * Failed and timed out runs go back to pending with a fresh retry budget.
     */
    public int restartFailedSimulations(Long queueId) {
        requireQueue(queueId);
        int restarted = resetRestartable(simulationRunRepository.findByQueueIdAndStatuses(queueId, RESTARTABLE));
        if (restarted > 0) {
            rearmAndDrain(queueId);
        }
        log.info("Failed runs restarted. queueId={}, restarted={}", queueId, restarted);
        return restarted;
    }

    /**
     * Like {@link #restartFailedSimulations(Long)} restricted to the given runs; every failed run when empty.
     */
    public int retryFailedRuns(Long queueId, List<Long> runIds) {
        requireQueue(queueId);
        List<SimulationRunEntity> candidates = new ArrayList<>(
                simulationRunRepository.findByQueueIdAndStatuses(queueId, RESTARTABLE));
        if (!isEmpty(runIds)) {
            Set<Long> wanted = new HashSet<>(runIds);
            candidates.removeIf(run -> !wanted.contains(run.getId()));
        }
        int retried = resetRestartable(candidates);
        if (retried > 0) {
            SimulationQueueEntity queue = rearmAndDrain(queueId);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("retriedCount", retried);
            data.put("message", "Retrying " + retried + " failed simulation(s)");
            simulationEventPublisher.publish(SimulationEventTypeEnum.QUEUE_PROGRESS, queueId, queue.getNegotiationId(), data);
        }
        log.info("Failed runs retried. queueId={}, requested={}, retried={}", queueId,
                runIds == null ? 0 : runIds.size(), retried);
        return retried;
    }

    /**
     * Any run that is not running goes back to pending with its results cleared.
     */
    public SimulationRunEntity restartSingleRun(Long runId) {
        SimulationRunEntity run = simulationRunRepository.findById(runId);
        if (run == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Simulation run not found: " + runId);
        }
        RunStatusEnum previous = run.getStatus();
        try {
            run.resetForSingleRestart(LocalDateTime.now());
        } catch (IllegalStateException ex) {
            throw new AppException(ResponseCode.ILLEGAL_STATE.getCode(), ex.getMessage());
        }
        if (!simulationRunRepository.updateIfStatus(run, previous)) {
            throw new AppException(ResponseCode.ILLEGAL_STATE.getCode(), "Simulation run changed concurrently: " + runId);
        }
        runResultRepository.replaceForRun(runId, Collections.emptyList(), Collections.emptyList());
        rearmAndDrain(run.getQueueId());
        log.info("Single run restarted. runId={}, queueId={}, previousStatus={}", runId, run.getQueueId(), previous);
        return run;
    }

    /**
     * {@code next} runs one executeNext synchronously, {@code all} hands the queue to a drain loop.
     *
     * @return whether more work is expected
     */
    public boolean executeQueue(Long queueId, String mode) {
        requireQueue(queueId);
        String normalized = mode == null ? MODE_NEXT : mode.trim().toLowerCase();
        if (MODE_NEXT.equals(normalized)) {
            return simulationQueueScheduler.executeOnce(queueId);
        }
        if (MODE_ALL.equals(normalized)) {
            simulationQueueScheduler.ensureDraining(queueId);
            return true;
        }
        throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Unknown execute mode: " + mode);
    }

    private int resetRestartable(List<SimulationRunEntity> runs) {
        int count = 0;
        for (SimulationRunEntity run : runs) {
            RunStatusEnum previous = run.getStatus();
            try {
                run.resetForRestart(LocalDateTime.now());
                if (simulationRunRepository.updateIfStatus(run, previous)) {
                    count++;
                }
            } catch (Exception ex) {
                log.warn("Failed to reset run. queueId={}, runId={}, error={}", run.getQueueId(), run.getId(), ex.getMessage());
            }
        }
        return count;
    }

    private SimulationQueueEntity rearmAndDrain(Long queueId) {
        SimulationQueueEntity queue = queueStatusApplicationService.rearm(queueId);
        queueStatusApplicationService.refreshRollup(queueId);
        simulationQueueScheduler.ensureDraining(queueId);
        return queue;
    }

    private SimulationQueueEntity requireQueue(Long queueId) {
        if (queueId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "queueId must not be null");
        }
        SimulationQueueEntity queue = simulationQueueRepository.findById(queueId);
        if (queue == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Queue not found: " + queueId);
        }
        return queue;
    }

    private <T> List<T> distinct(List<T> values) {
        List<T> result = new ArrayList<>();
        if (values == null) {
            return result;
        }
        for (T value : values) {
            if (value != null && !result.contains(value)) {
                result.add(value);
            }
        }
        return result;
    }

    private boolean isEmpty(List<?> values) {
        return values == null || values.isEmpty();
    }
}
