package com.dealsim.trigger.job;

import com.dealsim.domain.queue.adapter.repository.ISimulationQueueRepository;
import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.queue.model.valobj.QueueRunStats;
import com.dealsim.domain.run.adapter.gateway.INegotiationEngineGateway;
import com.dealsim.domain.run.adapter.gateway.IRunEvaluationHook;
import com.dealsim.domain.run.adapter.repository.ISimulationRunRepository;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.domain.run.model.valobj.NegotiationRequest;
import com.dealsim.domain.run.model.valobj.NegotiationResult;
import com.dealsim.domain.run.model.valobj.RoundUpdate;
import com.dealsim.domain.run.model.valobj.RunClaimResult;
import com.dealsim.domain.run.service.RunLifecycleDomainService;
import com.dealsim.trigger.application.command.QueueStatusApplicationService;
import com.dealsim.trigger.application.command.RunResultApplicationService;
import com.dealsim.trigger.event.SimulationEventPublisher;
import com.dealsim.types.enums.NegotiationOutcomeEnum;
import com.dealsim.types.enums.QueueStatusEnum;
import com.dealsim.types.enums.RunStatusEnum;
import com.dealsim.types.enums.SimulationEventTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Run executor: claims the next pending run of a queue, drives it through the engine and
 * records the outcome.
 */
@Slf4j
@Component
public class SimulationRunExecutor {

    private final ISimulationQueueRepository simulationQueueRepository;
    private final ISimulationRunRepository simulationRunRepository;
    private final INegotiationEngineGateway negotiationEngineGateway;
    private final IRunEvaluationHook runEvaluationHook;
    private final RunLifecycleDomainService runLifecycleDomainService;
    private final RunResultApplicationService runResultApplicationService;
    private final QueueStatusApplicationService queueStatusApplicationService;
    private final SimulationEventPublisher simulationEventPublisher;
    private final Executor evaluationExecutor;
    private final int maxRounds;
    private final BigDecimal costPerRound;

    public SimulationRunExecutor(ISimulationQueueRepository simulationQueueRepository,
                                 ISimulationRunRepository simulationRunRepository,
                                 INegotiationEngineGateway negotiationEngineGateway,
                                 IRunEvaluationHook runEvaluationHook,
                                 RunLifecycleDomainService runLifecycleDomainService,
                                 RunResultApplicationService runResultApplicationService,
                                 QueueStatusApplicationService queueStatusApplicationService,
                                 SimulationEventPublisher simulationEventPublisher,
                                 @Qualifier("commonThreadPoolExecutor") Executor evaluationExecutor,
                                 @Value("${simulation.executor.max-rounds:6}") int maxRounds,
                                 @Value("${simulation.executor.cost-per-round:0.006}") BigDecimal costPerRound) {
        this.simulationQueueRepository = simulationQueueRepository;
        this.simulationRunRepository = simulationRunRepository;
        this.negotiationEngineGateway = negotiationEngineGateway;
        this.runEvaluationHook = runEvaluationHook;
        this.runLifecycleDomainService = runLifecycleDomainService;
        this.runResultApplicationService = runResultApplicationService;
        this.queueStatusApplicationService = queueStatusApplicationService;
        this.simulationEventPublisher = simulationEventPublisher;
        this.evaluationExecutor = evaluationExecutor;
        this.maxRounds = maxRounds > 0 ? maxRounds : 6;
        this.costPerRound = costPerRound == null ? new BigDecimal("0.006") : costPerRound;
    }

    /**
     * Executes at most one run of the queue.
     *
     * @return true when the drain loop should keep going
     */
    public boolean executeNext(Long queueId) {
        SimulationQueueEntity queue = simulationQueueRepository.findById(queueId);
        if (queue == null) {
            log.warn("Queue not found, nothing to execute. queueId={}", queueId);
            return false;
        }
        if (!queue.isDispatchable()) {
            log.debug("Queue not dispatchable. queueId={}, status={}", queueId, queue.getStatus());
            return false;
        }

        RunClaimResult claim = simulationRunRepository.claimNextPending(queueId, LocalDateTime.now());
        if (claim.getKind() == RunClaimResult.Kind.AT_CAPACITY) {
            return true;
        }
        if (!claim.isClaimed()) {
            return completeDrainedQueue(queueId);
        }

        SimulationRunEntity run = claim.getRun();
        queue = markQueueRunning(queueId);
        if (queue == null) {
            releaseClaim(run);
            return false;
        }
        Map<String, Object> started = runPayload(run);
        started.put("techniqueId", run.getTechniqueId());
        started.put("tacticId", run.getTacticId());
        simulationEventPublisher.publish(SimulationEventTypeEnum.SIMULATION_STARTED, queueId, run.getNegotiationId(), started);
        log.info("Run claimed. queueId={}, runId={}, runNumber={}", queueId, run.getId(), run.getRunNumber());

        NegotiationResult result;
        try {
            result = negotiationEngineGateway.run(buildRequest(run), update -> publishRound(run, update));
        } catch (Exception ex) {
            handleFault(run, ex);
            return false;
        }

        if (simulationRunRepository.findStatus(run.getId()) != RunStatusEnum.RUNNING) {
            log.info("Run left RUNNING while the engine was busy, result discarded. queueId={}, runId={}",
                    queueId, run.getId());
            return true;
        }
        NegotiationOutcomeEnum outcome = runLifecycleDomainService.applyResult(run, result, costPerRound, LocalDateTime.now());
        if (!simulationRunRepository.updateIfRunning(run)) {
            log.info("Run state changed concurrently, result discarded. queueId={}, runId={}", queueId, run.getId());
            return true;
        }

        runResultApplicationService.processResult(run, result);
        QueueRunStats stats = queueStatusApplicationService.refreshRollup(queueId);

        Map<String, Object> completed = runPayload(run);
        completed.put("outcome", run.getOutcome());
        completed.put("status", run.getStatus().getCode());
        completed.put("totalRounds", run.getTotalRounds());
        completed.put("cost", run.getActualCost());
        completed.put("dealValue", run.getDealValue());
        completed.put("completed", stats.getCompletedCount());
        completed.put("total", queue.getTotalSimulations());
        simulationEventPublisher.publish(SimulationEventTypeEnum.SIMULATION_COMPLETED, queueId, run.getNegotiationId(), completed);
        log.info("Run finished. queueId={}, runId={}, outcome={}, status={}, rounds={}",
                queueId, run.getId(), run.getOutcome(), run.getStatus(), run.getTotalRounds());

        if (outcome.isEvaluable()) {
            submitEvaluation(run);
        }
        queueStatusApplicationService.publishProgressOrCompletion(queueId, stats);
        return true;
    }

    /**
     * Nothing was claimable. The queue is re-read after the claim, so a pause, stop or restart that
     * landed in between is never overwritten. Runs re-armed while the queue was being completed
     * bring it straight back to PENDING.
     */
    private boolean completeDrainedQueue(Long queueId) {
        SimulationQueueEntity queue = simulationQueueRepository.findById(queueId);
        if (queue == null || !queue.isDispatchable()) {
            return false;
        }
        QueueRunStats stats = queueStatusApplicationService.refreshRollup(queueId);
        if (stats.getPendingCount() > 0) {
            return true;
        }
        SimulationQueueEntity completed = queueStatusApplicationService.tryUpdateQueueStatus(queue, QueueStatusEnum.COMPLETED, null);
        if (completed == null) {
            return true;
        }
        if (simulationRunRepository.summarize(queueId).getPendingCount() > 0) {
            log.info("Runs were re-armed while the queue was completing, back to pending. queueId={}", queueId);
            queueStatusApplicationService.tryUpdateQueueStatus(completed, QueueStatusEnum.PENDING, null);
            return true;
        }
        queueStatusApplicationService.publishQueueCompleted(completed, stats, false);
        log.info("Queue has no pending runs left, marked completed. queueId={}", queueId);
        return false;
    }

    /**
     * @return the queue as RUNNING, or null when it stopped being dispatchable after the claim
     */
    private SimulationQueueEntity markQueueRunning(Long queueId) {
        SimulationQueueEntity queue = simulationQueueRepository.findById(queueId);
        if (queue == null || !queue.isDispatchable()) {
            return null;
        }
        if (queue.getStatus() == QueueStatusEnum.RUNNING) {
            return queue;
        }
        return queueStatusApplicationService.tryUpdateQueueStatus(queue, QueueStatusEnum.RUNNING, null);
    }

    private void releaseClaim(SimulationRunEntity run) {
        run.releaseClaim(LocalDateTime.now());
        if (simulationRunRepository.updateIfRunning(run)) {
            log.info("Queue left dispatchable state after the claim, run handed back. queueId={}, runId={}",
                    run.getQueueId(), run.getId());
        }
    }

    private void handleFault(SimulationRunEntity run, Exception error) {
        Long queueId = run.getQueueId();
        if (simulationRunRepository.findStatus(run.getId()) != RunStatusEnum.RUNNING) {
            log.info("Engine fault on a run that already left RUNNING. queueId={}, runId={}, error={}",
                    queueId, run.getId(), error.getMessage());
            return;
        }
        RunLifecycleDomainService.FaultDecision decision =
                runLifecycleDomainService.applyFault(run, error, LocalDateTime.now());
        if (!simulationRunRepository.updateIfRunning(run)) {
            log.info("Run state changed concurrently, fault discarded. queueId={}, runId={}", queueId, run.getId());
            return;
        }
        if (decision == RunLifecycleDomainService.FaultDecision.RETRY) {
            log.warn("Engine fault, run returned to pending. queueId={}, runId={}, retryCount={}, maxRetries={}, error={}",
                    queueId, run.getId(), run.getRetryCount(), run.getMaxRetries(), error.getMessage());
            return;
        }
        log.warn("Engine fault, retries exhausted. queueId={}, runId={}, retryCount={}, error={}",
                queueId, run.getId(), run.getRetryCount(), error.getMessage());
        QueueRunStats stats = queueStatusApplicationService.refreshRollup(queueId);
        Map<String, Object> failed = runPayload(run);
        failed.put("error", error.getMessage());
        failed.put("retryCount", run.getRetryCount());
        simulationEventPublisher.publish(SimulationEventTypeEnum.SIMULATION_FAILED, queueId, run.getNegotiationId(), failed);
        queueStatusApplicationService.publishProgressOrCompletion(queueId, stats);
    }

    private NegotiationRequest buildRequest(SimulationRunEntity run) {
        return NegotiationRequest.builder()
                .negotiationId(run.getNegotiationId())
                .runId(run.getId())
                .queueId(run.getQueueId())
                .techniqueId(run.getTechniqueId())
                .tacticId(run.getTacticId())
                .personalityId(run.getPersonalityId())
                .zopaDistance(run.getZopaDistance())
                .maxRounds(maxRounds)
                .build();
    }

    private void publishRound(SimulationRunEntity run, RoundUpdate update) {
        if (update == null) {
            return;
        }
        Map<String, Object> data = runPayload(run);
        data.put("round", update.getRound());
        data.put("agent", update.getAgent());
        data.put("message", update.getMessage());
        data.put("offer", update.getOffer());
        simulationEventPublisher.publish(SimulationEventTypeEnum.NEGOTIATION_ROUND, run.getQueueId(), run.getNegotiationId(), data);
    }

    private void submitEvaluation(SimulationRunEntity run) {
        Long runId = run.getId();
        Long negotiationId = run.getNegotiationId();
        String outcome = run.getOutcome();
        try {
            evaluationExecutor.execute(() -> {
                try {
                    runEvaluationHook.evaluate(runId, negotiationId, outcome);
                } catch (Exception ex) {
                    log.warn("Run evaluation failed. runId={}, outcome={}, error={}", runId, outcome, ex.getMessage());
                }
            });
        } catch (RejectedExecutionException ex) {
            log.warn("Run evaluation rejected. runId={}, error={}", runId, ex.getMessage());
        }
    }

    private Map<String, Object> runPayload(SimulationRunEntity run) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("simulationId", run.getId());
        data.put("runNumber", run.getRunNumber());
        return data;
    }
}
