package com.dealsim.test.integration;

import com.dealsim.Application;
import com.dealsim.domain.queue.adapter.repository.ISimulationQueueRepository;
import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.queue.model.valobj.QueueCreateCommand;
import com.dealsim.domain.run.adapter.repository.ISimulationRunRepository;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.domain.run.model.valobj.NegotiationResult;
import com.dealsim.domain.run.model.valobj.RunClaimResult;
import com.dealsim.trigger.application.command.SimulationQueueCommandService;
import com.dealsim.types.enums.NegotiationOutcomeEnum;
import com.dealsim.types.enums.QueueStatusEnum;
import com.dealsim.types.enums.RunStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

@SpringBootTest(
        classes = Application.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "spring.task.scheduling.enabled=false",
                "observability.http-log.enabled=false"
        }
)
@EnabledIfSystemProperty(named = "it.docker.enabled", matches = "true")
public class SimulationRunClaimIntegrationTest extends PostgresIntegrationTestSupport {

    @Autowired
    private SimulationQueueCommandService simulationQueueCommandService;

    @Autowired
    private ISimulationRunRepository simulationRunRepository;

    @Autowired
    private ISimulationQueueRepository simulationQueueRepository;

    @Test
    public void shouldLetOnlyOneConcurrentClaimWinPerQueue() throws Exception {
        SimulationQueueEntity queue = createQueue(Arrays.asList(1L, 2L, 3L));

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<RunClaimResult>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(pool.submit(() -> {
                    start.await(2, TimeUnit.SECONDS);
                    return simulationRunRepository.claimNextPending(queue.getId(), LocalDateTime.now());
                }));
            }
            start.countDown();

            int claimed = 0;
            int atCapacity = 0;
            for (Future<RunClaimResult> future : futures) {
                RunClaimResult result = future.get(5, TimeUnit.SECONDS);
                if (result.isClaimed()) {
                    claimed++;
                    Assertions.assertEquals(1, result.getRun().getExecutionOrder());
                } else if (result.getKind() == RunClaimResult.Kind.AT_CAPACITY) {
                    atCapacity++;
                }
            }
            Assertions.assertEquals(1, claimed, "exactly one run may be running per queue");
            Assertions.assertEquals(3, atCapacity);
        } finally {
            pool.shutdownNow();
        }
        Assertions.assertEquals(1, simulationRunRepository.findByQueueIdAndStatuses(queue.getId(),
                Collections.singletonList(RunStatusEnum.RUNNING)).size());
    }

    @Test
    public void shouldRejectEngineWritebackAfterStop() {
        SimulationQueueEntity queue = createQueue(Collections.singletonList(1L));
        RunClaimResult claim = simulationRunRepository.claimNextPending(queue.getId(), LocalDateTime.now());
        Assertions.assertTrue(claim.isClaimed());

        Assertions.assertEquals(1, simulationQueueCommandService.stopQueue(queue.getId()));

        SimulationRunEntity late = claim.getRun();
        late.applyResult(NegotiationResult.builder()
                .outcome(NegotiationOutcomeEnum.DEAL_ACCEPTED)
                .rawOutcome("DEAL_ACCEPTED")
                .totalRounds(3)
                .build(), new BigDecimal("0.0180"), LocalDateTime.now());
        Assertions.assertFalse(simulationRunRepository.updateIfRunning(late));
        Assertions.assertEquals(RunStatusEnum.ABORTED, simulationRunRepository.findStatus(late.getId()));
        Assertions.assertTrue(simulationRunRepository.findById(late.getId()).wasAbortedWhileRunning());
        Assertions.assertEquals(QueueStatusEnum.COMPLETED, simulationQueueRepository.findById(queue.getId()).getStatus());
    }

    @Test
    public void shouldRejectQueueStatusWriteFromOutdatedRead() {
        SimulationQueueEntity queue = createQueue(Collections.singletonList(1L));
        SimulationQueueEntity outdated = simulationQueueRepository.findById(queue.getId());

        simulationQueueCommandService.pauseQueue(queue.getId());

        outdated.complete(LocalDateTime.now());
        Assertions.assertFalse(simulationQueueRepository.updateStatus(outdated, QueueStatusEnum.PENDING));
        Assertions.assertEquals(QueueStatusEnum.PAUSED, simulationQueueRepository.findById(queue.getId()).getStatus());
    }

    @Test
    public void shouldReapStaleRunExactlyOnce() {
        SimulationQueueEntity queue = createQueue(Collections.singletonList(1L));
        RunClaimResult claim = simulationRunRepository.claimNextPending(queue.getId(), LocalDateTime.now());
        jdbcTemplate.update("UPDATE simulation_runs SET started_at = CURRENT_TIMESTAMP - INTERVAL '30 minutes' WHERE id = ?",
                claim.getRun().getId());

        LocalDateTime threshold = LocalDateTime.now().minusMinutes(10);
        List<SimulationRunEntity> first = simulationRunRepository.markStaleRunningAsTimeout(threshold, LocalDateTime.now());
        List<SimulationRunEntity> second = simulationRunRepository.markStaleRunningAsTimeout(threshold, LocalDateTime.now());

        Assertions.assertEquals(1, first.size());
        Assertions.assertTrue(second.isEmpty());
        Assertions.assertEquals(RunStatusEnum.TIMEOUT, simulationRunRepository.findStatus(claim.getRun().getId()));
        Assertions.assertEquals(1, simulationRunRepository.summarize(queue.getId()).getFailedCount());
    }

    private SimulationQueueEntity createQueue(List<Long> tacticIds) {
        Long negotiationId = insertNegotiation("buyer");
        return simulationQueueCommandService.createQueue(QueueCreateCommand.builder()
                .negotiationId(negotiationId)
                .techniqueIds(Collections.singletonList(1L))
                .tacticIds(tacticIds)
                .personalitySelector(Collections.singletonList("analytical"))
                .distanceSelector(Collections.singletonList("medium"))
                .build());
    }
}
