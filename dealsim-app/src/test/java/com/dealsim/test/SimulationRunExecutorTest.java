package com.dealsim.test;

import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.queue.model.valobj.SimulationEvent;
import com.dealsim.domain.result.model.valobj.ProductDefinition;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.domain.run.model.valobj.NegotiationRequest;
import com.dealsim.test.support.ScriptedNegotiationEngine;
import com.dealsim.test.support.SimulationTestContext;
import com.dealsim.types.enums.NegotiationStatusEnum;
import com.dealsim.types.enums.QueueStatusEnum;
import com.dealsim.types.enums.RunStatusEnum;
import com.dealsim.types.enums.SimulationEventTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

public class SimulationRunExecutorTest {

    private SimulationTestContext context;

    @BeforeEach
    public void setUp() {
        context = new SimulationTestContext();
    }

    @Test
    public void shouldDrainMatrixInExecutionOrderAndCompleteQueue() {
        context.negotiationRepository.add(1L, "seller");
        context.catalogRepository.addProduct(1L, ProductDefinition.builder()
                .id(1L).name("WidgetA").productKey("widget_a").targetPrice(12.0).estimatedVolume(100L).build());
        Map<String, Object> finalValues = new LinkedHashMap<>();
        finalValues.put("Preis_WidgetA", 12.5);
        context.engine.setScript(request -> ScriptedNegotiationEngine.deal(3, finalValues));
        SimulationQueueEntity queue = context.createQueue(1L, Arrays.asList(1L, 2L), Arrays.asList(10L, 20L));

        int productive = context.drainSynchronously(queue.getId(), 20);

        Assertions.assertEquals(4, productive);
        SimulationQueueEntity stored = context.queueRepository.findById(queue.getId());
        Assertions.assertEquals(QueueStatusEnum.COMPLETED, stored.getStatus());
        Assertions.assertEquals(4, stored.getCompletedCount());
        Assertions.assertEquals(0, stored.getFailedCount());
        Assertions.assertEquals(0, new BigDecimal("0.0720").compareTo(stored.getActualTotalCost()));

        List<SimulationRunEntity> runs = context.runRepository.findByQueueId(queue.getId());
        Assertions.assertTrue(runs.stream().allMatch(run -> run.getStatus() == RunStatusEnum.COMPLETED));
        Assertions.assertTrue(runs.stream().allMatch(run -> "1250.00".equals(run.getDealValue())));
        Assertions.assertEquals(1, context.runResultRepository.findProductResultsByRunId(runs.get(0).getId()).size());

        List<Long> dispatchOrder = context.engine.getRequests().stream()
                .map(NegotiationRequest::getRunId)
                .collect(Collectors.toList());
        Assertions.assertEquals(runs.stream().map(SimulationRunEntity::getId).collect(Collectors.toList()), dispatchOrder);
        Assertions.assertEquals(6, context.engine.getRequests().get(0).getMaxRounds());

        Assertions.assertEquals(4, context.eventsOf(SimulationEventTypeEnum.SIMULATION_STARTED).size());
        Assertions.assertEquals(4, context.eventsOf(SimulationEventTypeEnum.SIMULATION_COMPLETED).size());
        Assertions.assertEquals(1, context.eventsOf(SimulationEventTypeEnum.QUEUE_COMPLETED).size());
        Assertions.assertEquals(4, context.evaluatedRunIds.size());
        List<NegotiationStatusEnum> history = context.negotiationRepository.getStatusHistory();
        Assertions.assertEquals(NegotiationStatusEnum.COMPLETED, history.get(history.size() - 1));
    }

    @Test
    public void shouldCompleteQueueWhenNothingIsPending() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L);
        SimulationRunEntity run = context.runRepository.findByQueueId(queue.getId()).get(0);
        context.runRepository.forceStatus(run.getId(), RunStatusEnum.ABORTED);

        boolean more = context.executor.executeNext(queue.getId());

        Assertions.assertFalse(more);
        Assertions.assertEquals(QueueStatusEnum.COMPLETED, context.queueRepository.findById(queue.getId()).getStatus());
        Assertions.assertTrue(context.engine.getRequests().isEmpty());
        Assertions.assertEquals(1, context.eventsOf(SimulationEventTypeEnum.QUEUE_COMPLETED).size());
    }

    @Test
    public void shouldReportCapacityWhenAnotherRunIsRunning() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L, 20L);
        SimulationRunEntity first = context.runRepository.findByQueueId(queue.getId()).get(0);
        context.runRepository.forceRunning(first.getId(), LocalDateTime.now());

        boolean more = context.executor.executeNext(queue.getId());

        Assertions.assertTrue(more);
        Assertions.assertTrue(context.engine.getRequests().isEmpty());
        Assertions.assertEquals(RunStatusEnum.PENDING,
                context.runRepository.findByQueueId(queue.getId()).get(1).getStatus());
    }

    @Test
    public void shouldNotDispatchPausedQueue() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L);
        context.commandService.pauseQueue(queue.getId());

        Assertions.assertFalse(context.executor.executeNext(queue.getId()));
        Assertions.assertTrue(context.engine.getRequests().isEmpty());
    }

    @Test
    public void shouldFailRunAfterRetriesAreExhausted() {
        context.engine.setScript(request -> {
            throw new IllegalStateException("engine down");
        });
        SimulationQueueEntity queue = context.createQueue(1L, 10L);

        for (int attempt = 0; attempt < 3; attempt++) {
            Assertions.assertFalse(context.executor.executeNext(queue.getId()));
        }

        SimulationRunEntity run = context.runRepository.findByQueueId(queue.getId()).get(0);
        Assertions.assertEquals(RunStatusEnum.FAILED, run.getStatus());
        Assertions.assertEquals(3, run.getRetryCount());
        Assertions.assertEquals("engine down", run.getMetadata().get(SimulationRunEntity.META_LAST_ERROR));
        Assertions.assertEquals(3, context.engine.getRequests().size());

        SimulationQueueEntity stored = context.queueRepository.findById(queue.getId());
        Assertions.assertEquals(1, stored.getFailedCount());
        Assertions.assertEquals(QueueStatusEnum.COMPLETED, stored.getStatus());
        List<SimulationEvent> failures = context.eventsOf(SimulationEventTypeEnum.SIMULATION_FAILED);
        Assertions.assertEquals(1, failures.size());
        Assertions.assertEquals(3, failures.get(0).getData().get("retryCount"));
        Assertions.assertFalse(context.executor.executeNext(queue.getId()));
        Assertions.assertEquals(3, context.engine.getRequests().size());
    }

    @Test
    public void shouldKeepAbortedStatusWhenStoppedWhileEngineIsBusy() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L, 20L);
        context.engine.setScript(request -> {
            context.commandService.stopQueue(request.getQueueId());
            return ScriptedNegotiationEngine.deal(5, null);
        });

        boolean more = context.executor.executeNext(queue.getId());

        Assertions.assertTrue(more);
        List<SimulationRunEntity> runs = context.runRepository.findByQueueId(queue.getId());
        Assertions.assertTrue(runs.stream().allMatch(run -> run.getStatus() == RunStatusEnum.ABORTED));
        Assertions.assertNull(runs.get(0).getOutcome());
        Assertions.assertEquals(Collections.singletonList(runs.get(0).getId()), context.engine.getCancelledRunIds());
        Assertions.assertEquals(2, context.eventsOf(SimulationEventTypeEnum.SIMULATION_STOPPED).size());
        Assertions.assertTrue(context.eventsOf(SimulationEventTypeEnum.SIMULATION_COMPLETED).isEmpty());
        Assertions.assertEquals(QueueStatusEnum.COMPLETED, context.queueRepository.findById(queue.getId()).getStatus());
        Assertions.assertFalse(context.executor.executeNext(queue.getId()));
    }

    @Test
    public void shouldClassifyEngineOutcomes() {
        Map<Long, String> outcomeByTactic = new LinkedHashMap<>();
        outcomeByTactic.put(1L, "DEAL_ACCEPTED");
        outcomeByTactic.put(2L, "MAX_ROUNDS_REACHED");
        outcomeByTactic.put(3L, "PAUSED");
        outcomeByTactic.put(4L, "negotiation_exploded");
        context.engine.setScript(request ->
                ScriptedNegotiationEngine.result(outcomeByTactic.get(request.getTacticId()), 6, null));
        SimulationQueueEntity queue = context.createQueue(1L, 1L, 2L, 3L, 4L);

        context.drainSynchronously(queue.getId(), 20);

        List<SimulationRunEntity> runs = context.runRepository.findByQueueId(queue.getId());
        Assertions.assertEquals(RunStatusEnum.COMPLETED, runs.get(0).getStatus());
        Assertions.assertEquals(RunStatusEnum.TIMEOUT, runs.get(1).getStatus());
        Assertions.assertEquals(RunStatusEnum.PAUSED, runs.get(2).getStatus());
        Assertions.assertEquals(RunStatusEnum.FAILED, runs.get(3).getStatus());
        Assertions.assertEquals("negotiation_exploded", runs.get(3).getOutcome());
        Assertions.assertEquals(Arrays.asList(runs.get(0).getId(), runs.get(1).getId()), context.evaluatedRunIds);

        SimulationQueueEntity stored = context.queueRepository.findById(queue.getId());
        Assertions.assertEquals(QueueStatusEnum.COMPLETED, stored.getStatus());
        Assertions.assertEquals(1, stored.getCompletedCount());
        Assertions.assertEquals(2, stored.getFailedCount());
    }

    @Test
    public void shouldIsolateEvaluationHookFailure() {
        context.setEvaluationHook((runId, negotiationId, outcome) -> {
            throw new IllegalStateException("evaluator offline");
        });
        SimulationQueueEntity queue = context.createQueue(1L, 10L);

        Assertions.assertTrue(context.executor.executeNext(queue.getId()));

        SimulationRunEntity run = context.runRepository.findByQueueId(queue.getId()).get(0);
        Assertions.assertEquals(RunStatusEnum.COMPLETED, run.getStatus());
        Assertions.assertEquals(QueueStatusEnum.COMPLETED, context.queueRepository.findById(queue.getId()).getStatus());
    }

    @Test
    public void shouldBroadcastRoundsWhileRunExecutes() {
        context.engine.setRoundsToEmit(2);
        SimulationQueueEntity queue = context.createQueue(1L, 10L);

        context.executor.executeNext(queue.getId());

        List<SimulationEvent> rounds = context.eventsOf(SimulationEventTypeEnum.NEGOTIATION_ROUND);
        Assertions.assertEquals(2, rounds.size());
        Assertions.assertEquals(1, rounds.get(0).getData().get("round"));
        Assertions.assertEquals("opponent", rounds.get(1).getData().get("agent"));
        Assertions.assertEquals(queue.getId(), rounds.get(0).getQueueId());
    }

    @Test
    public void shouldKeepRestartedRunsWhenRestartLandsAfterEmptyClaim() {
        List<Runnable> parkedDrains = new ArrayList<>();
        SimulationTestContext racing = new SimulationTestContext(parkedDrains::add);
        SimulationQueueEntity queue = racing.createQueue(1L, 10L);
        SimulationRunEntity run = racing.runRepository.findByQueueId(queue.getId()).get(0);
        racing.runRepository.forceStatus(run.getId(), RunStatusEnum.FAILED);
        racing.queueStatusService.updateQueueStatus(queue.getId(), QueueStatusEnum.RUNNING, null);
        AtomicBoolean restarted = new AtomicBoolean();
        racing.runRepository.setAfterClaim(result -> {
            if (!result.isClaimed() && restarted.compareAndSet(false, true)) {
                racing.commandService.restartFailedSimulations(queue.getId());
            }
        });

        Assertions.assertTrue(racing.executor.executeNext(queue.getId()));

        Assertions.assertTrue(restarted.get());
        Assertions.assertTrue(racing.queueRepository.findById(queue.getId()).isDispatchable());
        Assertions.assertEquals(RunStatusEnum.PENDING, racing.runRepository.findStatus(run.getId()));
        Assertions.assertTrue(racing.eventsOf(SimulationEventTypeEnum.QUEUE_COMPLETED).isEmpty());

        Assertions.assertTrue(racing.executor.executeNext(queue.getId()));

        Assertions.assertEquals(RunStatusEnum.COMPLETED, racing.runRepository.findStatus(run.getId()));
        Assertions.assertEquals(QueueStatusEnum.COMPLETED, racing.queueRepository.findById(queue.getId()).getStatus());
        Assertions.assertEquals(1, racing.engine.getRequests().size());
    }

    @Test
    public void shouldHandClaimBackWhenPauseLandsAfterClaim() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L, 20L);
        AtomicBoolean paused = new AtomicBoolean();
        context.runRepository.setAfterClaim(result -> {
            if (result.isClaimed() && paused.compareAndSet(false, true)) {
                context.commandService.pauseQueue(queue.getId());
            }
        });

        Assertions.assertFalse(context.executor.executeNext(queue.getId()));

        SimulationQueueEntity stored = context.queueRepository.findById(queue.getId());
        Assertions.assertEquals(QueueStatusEnum.PAUSED, stored.getStatus());
        Assertions.assertNotNull(stored.getPausedAt());
        SimulationRunEntity first = context.runRepository.findByQueueId(queue.getId()).get(0);
        Assertions.assertEquals(RunStatusEnum.PENDING, first.getStatus());
        Assertions.assertNull(first.getStartedAt());
        Assertions.assertEquals(0, first.getRetryCount());
        Assertions.assertNull(first.getCheckpoint());
        Assertions.assertTrue(context.engine.getRequests().isEmpty());
        Assertions.assertTrue(context.eventsOf(SimulationEventTypeEnum.SIMULATION_STARTED).isEmpty());

        Assertions.assertFalse(context.executor.executeNext(queue.getId()));
        Assertions.assertTrue(context.engine.getRequests().isEmpty());
    }

    @Test
    public void shouldNotDispatchWhenStopLandsAfterClaim() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L, 20L);
        AtomicBoolean stopped = new AtomicBoolean();
        context.runRepository.setAfterClaim(result -> {
            if (result.isClaimed() && stopped.compareAndSet(false, true)) {
                context.commandService.stopQueue(queue.getId());
            }
        });

        Assertions.assertFalse(context.executor.executeNext(queue.getId()));

        List<SimulationRunEntity> runs = context.runRepository.findByQueueId(queue.getId());
        Assertions.assertTrue(runs.stream().allMatch(run -> run.getStatus() == RunStatusEnum.ABORTED));
        Assertions.assertTrue(runs.get(0).wasAbortedWhileRunning());
        Assertions.assertFalse(runs.get(1).wasAbortedWhileRunning());
        Assertions.assertEquals(Collections.singletonList(runs.get(0).getId()), context.engine.getCancelledRunIds());
        Assertions.assertTrue(context.engine.getRequests().isEmpty());
        Assertions.assertEquals(QueueStatusEnum.COMPLETED, context.queueRepository.findById(queue.getId()).getStatus());
    }
}
