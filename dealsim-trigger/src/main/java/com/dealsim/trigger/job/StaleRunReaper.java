package com.dealsim.trigger.job;

import com.dealsim.domain.queue.model.valobj.QueueRunStats;
import com.dealsim.domain.run.adapter.gateway.INegotiationEngineGateway;
import com.dealsim.domain.run.adapter.repository.ISimulationRunRepository;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.trigger.application.command.QueueStatusApplicationService;
import com.dealsim.trigger.event.SimulationEventPublisher;
import com.dealsim.types.enums.SimulationEventTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Moves runs stuck in RUNNING past the stale window to TIMEOUT.
 */
@Slf4j
@Component
public class StaleRunReaper {

    private static final int DEFAULT_STALE_MINUTES = 10;

    private final ISimulationRunRepository simulationRunRepository;
    private final INegotiationEngineGateway negotiationEngineGateway;
    private final QueueStatusApplicationService queueStatusApplicationService;
    private final SimulationEventPublisher simulationEventPublisher;
    private final int staleThresholdMinutes;

    public StaleRunReaper(ISimulationRunRepository simulationRunRepository,
                          INegotiationEngineGateway negotiationEngineGateway,
                          QueueStatusApplicationService queueStatusApplicationService,
                          SimulationEventPublisher simulationEventPublisher,
                          @Value("${simulation.reaper.stale-threshold-minutes:10}") int staleThresholdMinutes) {
        this.simulationRunRepository = simulationRunRepository;
        this.negotiationEngineGateway = negotiationEngineGateway;
        this.queueStatusApplicationService = queueStatusApplicationService;
        this.simulationEventPublisher = simulationEventPublisher;
        this.staleThresholdMinutes = staleThresholdMinutes > 0 ? staleThresholdMinutes : DEFAULT_STALE_MINUTES;
    }

    /**
     * @return number of runs reaped by this pass
     */
    public int reapStaleRuns() {
        LocalDateTime now = LocalDateTime.now();
        List<SimulationRunEntity> reaped = simulationRunRepository.markStaleRunningAsTimeout(
                now.minusMinutes(staleThresholdMinutes), now);
        if (reaped == null || reaped.isEmpty()) {
            return 0;
        }

        Map<Long, List<SimulationRunEntity>> byQueue = reaped.stream()
                .filter(run -> run.getQueueId() != null)
                .collect(Collectors.groupingBy(SimulationRunEntity::getQueueId, LinkedHashMap::new, Collectors.toList()));

        for (Map.Entry<Long, List<SimulationRunEntity>> entry : byQueue.entrySet()) {
            Long queueId = entry.getKey();
            try {
                QueueRunStats stats = queueStatusApplicationService.refreshRollup(queueId);
                for (SimulationRunEntity run : entry.getValue()) {
                    cancelQuietly(run);
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("simulationId", run.getId());
                    data.put("runNumber", run.getRunNumber());
                    data.put("error", "timeout");
                    simulationEventPublisher.publish(SimulationEventTypeEnum.SIMULATION_FAILED,
                            queueId, run.getNegotiationId(), data);
                }
                queueStatusApplicationService.publishProgressOrCompletion(queueId, stats);
            } catch (Exception ex) {
                log.warn("Failed to settle queue after reaping. queueId={}, error={}", queueId, ex.getMessage());
            }
        }
        log.warn("Stale runs moved to timeout. count={}, queues={}, thresholdMinutes={}",
                reaped.size(), byQueue.keySet(), staleThresholdMinutes);
        return reaped.size();
    }

    private void cancelQuietly(SimulationRunEntity run) {
        try {
            negotiationEngineGateway.cancel(run.getId());
        } catch (Exception ex) {
            log.debug("Engine cancel failed for reaped run. runId={}, error={}", run.getId(), ex.getMessage());
        }
    }
}
