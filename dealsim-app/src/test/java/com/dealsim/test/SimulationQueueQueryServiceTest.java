package com.dealsim.test;

import com.dealsim.api.dto.QueueStatusDTO;
import com.dealsim.api.dto.QueueSummaryDTO;
import com.dealsim.api.dto.RunResultDTO;
import com.dealsim.api.dto.SimulationStatsDTO;
import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.test.support.SimulationTestContext;
import com.dealsim.types.enums.ResponseCode;
import com.dealsim.types.enums.RunStatusEnum;
import com.dealsim.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

public class SimulationQueueQueryServiceTest {

    private SimulationTestContext context;

    @BeforeEach
    public void setUp() {
        context = new SimulationTestContext();
    }

    @Test
    public void shouldComputeNegotiationStats() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L, 20L, 30L);
        List<SimulationRunEntity> runs = context.runRepository.findByQueueId(queue.getId());
        context.runRepository.forceStatus(runs.get(0).getId(), RunStatusEnum.COMPLETED);
        context.runRepository.forceStatus(runs.get(1).getId(), RunStatusEnum.TIMEOUT);

        SimulationStatsDTO stats = context.queryService.getSimulationStats(1L);

        Assertions.assertEquals(3, stats.getTotalRuns());
        Assertions.assertEquals(1, stats.getCompletedRuns());
        Assertions.assertEquals(1, stats.getFailedRuns());
        Assertions.assertEquals(1, stats.getPendingRuns());
        Assertions.assertEquals(33.33D, stats.getSuccessRate());
        Assertions.assertTrue(stats.getIsPlanned());

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> context.queryService.getSimulationStats(404L));
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), ex.getCode());
    }

    @Test
    public void shouldDescribeRunningQueue() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L, 20L);
        SimulationRunEntity first = context.runRepository.findByQueueId(queue.getId()).get(0);
        context.runRepository.forceRunning(first.getId(), LocalDateTime.now());

        QueueStatusDTO status = context.queryService.getQueueStatus(queue.getId());

        Assertions.assertEquals("pending", status.getStatus());
        Assertions.assertEquals(1, status.getRunningCount());
        Assertions.assertEquals(1, status.getPendingCount());
        Assertions.assertEquals(first.getId(), status.getCurrentSimulation().getRunId());
        Assertions.assertEquals(120L, status.getEstimatedTimeRemaining());
    }

    @Test
    public void shouldListQueuesAndResults() {
        SimulationQueueEntity queue = context.createQueue(1L, 10L, 20L);
        context.drainSynchronously(queue.getId(), 5);

        List<QueueSummaryDTO> queues = context.queryService.getQueuesByNegotiation(1L);
        List<RunResultDTO> results = context.queryService.getQueueResults(queue.getId());

        Assertions.assertEquals(1, queues.size());
        Assertions.assertEquals("completed", queues.get(0).getStatus());
        Assertions.assertEquals(2, queues.get(0).getCompletedCount());
        Assertions.assertEquals(2, results.size());
        Assertions.assertTrue(context.queryService.getSystemStatus().getProcessingQueues().isEmpty());
    }
}
