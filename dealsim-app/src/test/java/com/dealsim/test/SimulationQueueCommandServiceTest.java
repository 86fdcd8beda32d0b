package com.dealsim.test;

import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.queue.model.valobj.QueueCreateCommand;
import com.dealsim.domain.queue.model.valobj.SimulationEvent;
import com.dealsim.domain.result.model.entity.ProductResultEntity;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.test.support.SimulationTestContext;
import com.dealsim.types.enums.NegotiationStatusEnum;
import com.dealsim.types.enums.QueueStatusEnum;
import com.dealsim.types.enums.ResponseCode;
import com.dealsim.types.enums.RunStatusEnum;
import com.dealsim.types.enums.SimulationEventTypeEnum;
import com.dealsim.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class SimulationQueueCommandServiceTest {

    private final List<Runnable> parkedDrains = new ArrayList<>();
    private SimulationTestContext context;

    @BeforeEach
    public void setUp() {
        parkedDrains.clear();
        context = new SimulationTestContext(parkedDrains::add);
    }

    @Test
    public void shouldExpandSelectorsIntoFullMatrix() {
        context.negotiationRepository.add(1L, "buyer");
        context.catalogRepository.addPersonality("analytical");
        context.catalogRepository.addPersonality("aggressive");

        SimulationQueueEntity queue = context.commandService.createQueue(QueueCreateCommand.builder()
                .negotiationId(1L)
                .techniqueIds(Arrays.asList(1L, 2L, 2L))
                .tacticIds(Collections.singletonList(10L))
                .personalitySelector(Collections.singletonList("all"))
                .distanceSelector(Collections.singletonList("all"))
                .build());

        Assertions.assertEquals(12, queue.getTotalSimulations());
        Assertions.assertEquals(QueueStatusEnum.PENDING, queue.getStatus());
        Assertions.assertEquals(12, context.runRepository.findByQueueId(queue.getId()).size());
        Assertions.assertEquals(NegotiationStatusEnum.PLANNED, context.negotiationRepository.findById(1L).getStatus());
    }

    @Test
    public void shouldReuseActiveQueueOfSameNegotiation() {
        SimulationQueueEntity first = context.createQueue(1L, 10L);
        SimulationQueueEntity second = context.createQueue(1L, 10L, 20L);

        Assertions.assertEquals(first.getId(), second.getId());
        Assertions.assertEquals(1, context.runRepository.findByQueueId(first.getId()).size());
    }

    @Test
    public void shouldRejectInvalidCreateRequests() {
        context.negotiationRepository.add(1L, "buyer");

        AppException empty = Assertions.assertThrows(AppException.class, () -> context.commandService.createQueue(
                QueueCreateCommand.builder().negotiationId(1L).techniqueIds(Collections.emptyList())
                        .tacticIds(Collections.singletonList(10L)).build()));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), empty.getCode());

        AppException missing = Assertions.assertThrows(AppException.class, () -> context.commandService.createQueue(
                QueueCreateCommand.builder().negotiationId(404L).techniqueIds(Collections.singletonList(1L))
                        .tacticIds(Collections.singletonList(10L)).build()));
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), missing.getCode());
    }

    @Test
    public void shouldRefuseToStartQueueWithoutPendingRuns() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L);
        SimulationRunEntity run = context.runRepository.findByQueueId(queue.getId()).get(0);
        context.runRepository.forceStatus(run.getId(), RunStatusEnum.COMPLETED);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> context.commandService.startQueue(queue.getId()));

        Assertions.assertEquals(ResponseCode.ILLEGAL_STATE.getCode(), ex.getCode());
        Assertions.assertTrue(parkedDrains.isEmpty());
    }

    @Test
    public void shouldStartPausedQueueAndHandItToDrainLoop() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L);
        context.commandService.pauseQueue(queue.getId());

        context.commandService.startQueue(queue.getId());

        Assertions.assertEquals(QueueStatusEnum.PENDING, context.queueRepository.findById(queue.getId()).getStatus());
        Assertions.assertEquals(1, parkedDrains.size());
        Assertions.assertEquals(Collections.singletonList(queue.getId()), context.scheduler.getProcessingQueueIds());
    }

    @Test
    public void shouldPauseAndResumeQueue() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L);

        context.commandService.pauseQueue(queue.getId());
        SimulationQueueEntity paused = context.queueRepository.findById(queue.getId());
        Assertions.assertEquals(QueueStatusEnum.PAUSED, paused.getStatus());
        Assertions.assertNotNull(paused.getPausedAt());
        Assertions.assertEquals(NegotiationStatusEnum.RUNNING, context.negotiationRepository.findById(1L).getStatus());

        context.commandService.resumeQueue(queue.getId());
        SimulationQueueEntity resumed = context.queueRepository.findById(queue.getId());
        Assertions.assertEquals(QueueStatusEnum.RUNNING, resumed.getStatus());
        Assertions.assertNull(resumed.getPausedAt());
        Assertions.assertEquals(1, parkedDrains.size());
    }

    @Test
    public void shouldRejectResumeOfCompletedQueue() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L);
        context.commandService.stopQueue(queue.getId());

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> context.commandService.resumeQueue(queue.getId()));

        Assertions.assertEquals(ResponseCode.ILLEGAL_STATE.getCode(), ex.getCode());
    }

    @Test
    public void shouldRestartFailedAndTimedOutRuns() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L, 20L, 30L);
        List<SimulationRunEntity> runs = context.runRepository.findByQueueId(queue.getId());
        context.runRepository.forceStatus(runs.get(0).getId(), RunStatusEnum.FAILED);
        context.runRepository.forceStatus(runs.get(1).getId(), RunStatusEnum.TIMEOUT);
        context.runRepository.forceStatus(runs.get(2).getId(), RunStatusEnum.COMPLETED);
        context.queueStatusService.updateQueueStatus(queue.getId(), QueueStatusEnum.COMPLETED, null);

        int restarted = context.commandService.restartFailedSimulations(queue.getId());

        Assertions.assertEquals(2, restarted);
        Assertions.assertEquals(RunStatusEnum.PENDING, context.runRepository.findStatus(runs.get(0).getId()));
        Assertions.assertEquals(RunStatusEnum.PENDING, context.runRepository.findStatus(runs.get(1).getId()));
        Assertions.assertEquals(RunStatusEnum.COMPLETED, context.runRepository.findStatus(runs.get(2).getId()));
        SimulationQueueEntity stored = context.queueRepository.findById(queue.getId());
        Assertions.assertEquals(QueueStatusEnum.PENDING, stored.getStatus());
        Assertions.assertNull(stored.getCompletedAt());
        Assertions.assertEquals(0, stored.getFailedCount());
        Assertions.assertEquals(1, parkedDrains.size());
    }

    @Test
    public void shouldRetryOnlyRequestedFailedRuns() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L, 20L);
        List<SimulationRunEntity> runs = context.runRepository.findByQueueId(queue.getId());
        context.runRepository.forceStatus(runs.get(0).getId(), RunStatusEnum.FAILED);
        context.runRepository.forceStatus(runs.get(1).getId(), RunStatusEnum.FAILED);

        int retried = context.commandService.retryFailedRuns(queue.getId(), Collections.singletonList(runs.get(1).getId()));

        Assertions.assertEquals(1, retried);
        Assertions.assertEquals(RunStatusEnum.FAILED, context.runRepository.findStatus(runs.get(0).getId()));
        Assertions.assertEquals(RunStatusEnum.PENDING, context.runRepository.findStatus(runs.get(1).getId()));
        List<SimulationEvent> progress = context.eventsOf(SimulationEventTypeEnum.QUEUE_PROGRESS);
        Assertions.assertEquals(1, progress.size());
        Assertions.assertEquals(1, progress.get(0).getData().get("retriedCount"));

        Assertions.assertEquals(0, context.commandService.retryFailedRuns(queue.getId(), Collections.singletonList(999L)));
        Assertions.assertEquals(1, context.commandService.retryFailedRuns(queue.getId(), null));
    }

    @Test
    public void shouldRestartSingleCompletedRunAndClearResults() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L);
        context.scheduler.executeOnce(queue.getId());
        SimulationRunEntity run = context.runRepository.findByQueueId(queue.getId()).get(0);
        context.runResultRepository.replaceForRun(run.getId(), Collections.emptyList(),
                Collections.singletonList(ProductResultEntity.builder().runId(run.getId()).productName("WidgetA").build()));
        Assertions.assertEquals(RunStatusEnum.COMPLETED, run.getStatus());

        SimulationRunEntity restarted = context.commandService.restartSingleRun(run.getId());

        Assertions.assertEquals(RunStatusEnum.PENDING, restarted.getStatus());
        SimulationRunEntity stored = context.runRepository.findById(run.getId());
        Assertions.assertEquals(RunStatusEnum.PENDING, stored.getStatus());
        Assertions.assertNull(stored.getOutcome());
        Assertions.assertEquals(0, stored.getRetryCount());
        Assertions.assertTrue(context.runResultRepository.findProductResultsByRunId(run.getId()).isEmpty());
        Assertions.assertEquals(QueueStatusEnum.PENDING, context.queueRepository.findById(queue.getId()).getStatus());
    }

    @Test
    public void shouldRejectSingleRestartOfRunningOrMissingRun() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L);
        SimulationRunEntity run = context.runRepository.findByQueueId(queue.getId()).get(0);
        context.runRepository.forceStatus(run.getId(), RunStatusEnum.RUNNING);

        AppException running = Assertions.assertThrows(AppException.class,
                () -> context.commandService.restartSingleRun(run.getId()));
        AppException missing = Assertions.assertThrows(AppException.class,
                () -> context.commandService.restartSingleRun(999L));

        Assertions.assertEquals(ResponseCode.ILLEGAL_STATE.getCode(), running.getCode());
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), missing.getCode());
    }

    @Test
    public void shouldStopQueueAbortingActiveRuns() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L, 20L, 30L);
        List<SimulationRunEntity> runs = context.runRepository.findByQueueId(queue.getId());
        context.runRepository.forceStatus(runs.get(0).getId(), RunStatusEnum.COMPLETED);

        int aborted = context.commandService.stopQueue(queue.getId());

        Assertions.assertEquals(2, aborted);
        Assertions.assertEquals(RunStatusEnum.COMPLETED, context.runRepository.findStatus(runs.get(0).getId()));
        Assertions.assertEquals(RunStatusEnum.ABORTED, context.runRepository.findStatus(runs.get(2).getId()));
        Assertions.assertEquals(QueueStatusEnum.COMPLETED, context.queueRepository.findById(queue.getId()).getStatus());
        List<SimulationEvent> completed = context.eventsOf(SimulationEventTypeEnum.QUEUE_COMPLETED);
        Assertions.assertEquals(1, completed.size());
        Assertions.assertEquals(Boolean.TRUE, completed.get(0).getData().get("stopped"));
        Assertions.assertEquals("manually_stopped",
                context.eventsOf(SimulationEventTypeEnum.SIMULATION_STOPPED).get(0).getData().get("reason"));
    }

    @Test
    public void shouldStopEveryActiveQueueOfNegotiation() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L);
        context.commandService.pauseQueue(queue.getId());
        SimulationQueueEntity second = context.createQueue(1L, 20L);

        Assertions.assertEquals(2, context.commandService.stopQueuesForNegotiation(1L));
        Assertions.assertEquals(QueueStatusEnum.COMPLETED, context.queueRepository.findById(second.getId()).getStatus());
        Assertions.assertEquals(0, context.commandService.stopQueuesForNegotiation(1L));
    }

    @Test
    public void shouldExecuteSingleStepOrRejectUnknownMode() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L, 20L);

        Assertions.assertTrue(context.commandService.executeQueue(queue.getId(), "next"));
        Assertions.assertEquals(1, context.engine.getRequests().size());

        Assertions.assertTrue(context.commandService.executeQueue(queue.getId(), "ALL"));
        Assertions.assertEquals(1, parkedDrains.size());

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> context.commandService.executeQueue(queue.getId(), "burst"));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }
}
