package com.dealsim.test;

import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.domain.run.model.valobj.RecoveryOpportunity;
import com.dealsim.test.support.SimulationTestContext;
import com.dealsim.types.enums.ResponseCode;
import com.dealsim.types.enums.RunStatusEnum;
import com.dealsim.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class RunRecoveryApplicationServiceTest {

    private SimulationTestContext context;

    @BeforeEach
    public void setUp() {
        context = new SimulationTestContext();
    }

    @Test
    public void shouldReportOrphansOlderThanThreshold() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L, 20L, 30L);
        List<SimulationRunEntity> runs = context.runRepository.findByQueueId(queue.getId());
        context.runRepository.forceRunning(runs.get(0).getId(), LocalDateTime.now().minusMinutes(20));
        context.runRepository.forceRunning(runs.get(1).getId(), LocalDateTime.now().minusMinutes(8));
        context.runRepository.forceRunning(runs.get(2).getId(), LocalDateTime.now().minusMinutes(1));

        RecoveryOpportunity opportunity = context.recoveryService.findRecoveryOpportunities(1L);

        Assertions.assertTrue(opportunity.isHasRecoverableSession());
        Assertions.assertEquals(queue.getId(), opportunity.getQueueId());
        Assertions.assertEquals(Arrays.asList(runs.get(1).getId(), runs.get(0).getId()),
                opportunity.getOrphanedSimulations());
        Assertions.assertEquals(runs.get(1).getId(), opportunity.getCheckpoint().get("simulationId"));
    }

    @Test
    public void shouldReportNothingForHealthyNegotiation() {
        context.createQueue(1L, 10L);

        RecoveryOpportunity opportunity = context.recoveryService.findRecoveryOpportunities(1L);

        Assertions.assertFalse(opportunity.isHasRecoverableSession());
        Assertions.assertTrue(opportunity.getOrphanedSimulations().isEmpty());

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> context.recoveryService.findRecoveryOpportunities(null));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }

    @Test
    public void shouldReturnOnlyRunningRunsToPending() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L, 20L);
        List<SimulationRunEntity> runs = context.runRepository.findByQueueId(queue.getId());
        context.runRepository.forceRunning(runs.get(0).getId(), LocalDateTime.now().minusMinutes(30));
        context.runRepository.forceStatus(runs.get(1).getId(), RunStatusEnum.COMPLETED);

        int recovered = context.recoveryService.recoverOrphanedSimulations(
                Arrays.asList(runs.get(0).getId(), runs.get(1).getId(), 999L));

        Assertions.assertEquals(1, recovered);
        SimulationRunEntity stored = context.runRepository.findById(runs.get(0).getId());
        Assertions.assertEquals(RunStatusEnum.PENDING, stored.getStatus());
        Assertions.assertNull(stored.getStartedAt());
        Assertions.assertEquals(Boolean.TRUE, stored.getMetadata().get("recovered"));
        Assertions.assertEquals(RunStatusEnum.COMPLETED, context.runRepository.findStatus(runs.get(1).getId()));
        Assertions.assertEquals(1, context.queueRepository.findById(queue.getId()).getCompletedCount());

        Assertions.assertEquals(0, context.recoveryService.recoverOrphanedSimulations(Collections.emptyList()));
        Assertions.assertEquals(0, context.recoveryService.recoverOrphanedSimulations(null));
    }

    @Test
    public void shouldDispatchRecoveredRunAgain() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L);
        SimulationRunEntity run = context.runRepository.findByQueueId(queue.getId()).get(0);
        context.runRepository.forceRunning(run.getId(), LocalDateTime.now().minusMinutes(30));
        Assertions.assertTrue(context.executor.executeNext(queue.getId()));
        Assertions.assertTrue(context.engine.getRequests().isEmpty());

        context.recoveryService.recoverOrphanedSimulations(Collections.singletonList(run.getId()));
        context.drainSynchronously(queue.getId(), 5);

        Assertions.assertEquals(1, context.engine.getRequests().size());
        Assertions.assertEquals(RunStatusEnum.COMPLETED, context.runRepository.findStatus(run.getId()));
    }
}
