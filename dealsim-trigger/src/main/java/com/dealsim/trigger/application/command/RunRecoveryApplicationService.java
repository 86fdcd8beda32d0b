package com.dealsim.trigger.application.command;

import com.dealsim.domain.queue.adapter.repository.ISimulationQueueRepository;
import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.run.adapter.repository.ISimulationRunRepository;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.domain.run.model.valobj.RecoveryOpportunity;
import com.dealsim.domain.run.service.RunRecoveryDomainService;
import com.dealsim.types.enums.ResponseCode;
import com.dealsim.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Crash recovery: finds runs left in RUNNING by a dead process and hands them back to the scheduler.
 */
@Slf4j
@Service
public class RunRecoveryApplicationService {

    private final ISimulationQueueRepository simulationQueueRepository;
    private final ISimulationRunRepository simulationRunRepository;
    private final RunRecoveryDomainService runRecoveryDomainService;
    private final QueueStatusApplicationService queueStatusApplicationService;
    private final int orphanThresholdMinutes;

    public RunRecoveryApplicationService(ISimulationQueueRepository simulationQueueRepository,
                                         ISimulationRunRepository simulationRunRepository,
                                         RunRecoveryDomainService runRecoveryDomainService,
                                         QueueStatusApplicationService queueStatusApplicationService,
                                         @Value("${simulation.recovery.orphan-threshold-minutes:5}") int orphanThresholdMinutes) {
        this.simulationQueueRepository = simulationQueueRepository;
        this.simulationRunRepository = simulationRunRepository;
        this.runRecoveryDomainService = runRecoveryDomainService;
        this.queueStatusApplicationService = queueStatusApplicationService;
        this.orphanThresholdMinutes = orphanThresholdMinutes > 0 ? orphanThresholdMinutes : 5;
    }

    public RecoveryOpportunity findRecoveryOpportunities(Long negotiationId) {
        if (negotiationId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "negotiationId must not be null");
        }
        List<SimulationQueueEntity> queues = simulationQueueRepository.findByNegotiationId(negotiationId);
        Long latestQueueId = queues == null || queues.isEmpty() ? null : queues.get(0).getId();
        List<SimulationRunEntity> orphans = simulationRunRepository.findStaleRunning(negotiationId,
                LocalDateTime.now().minusMinutes(orphanThresholdMinutes));
        return runRecoveryDomainService.describe(latestQueueId, orphans);
    }

    /**
     * @return number of runs that were still RUNNING and went back to PENDING
     */
    public int recoverOrphanedSimulations(List<Long> runIds) {
        if (runIds == null || runIds.isEmpty()) {
            return 0;
        }
        int recovered = 0;
        Set<Long> touchedQueues = new LinkedHashSet<>();
        for (Long runId : runIds) {
            SimulationRunEntity run = simulationRunRepository.findById(runId);
            if (run == null || !run.isRunning()) {
                continue;
            }
            try {
                run.recoverOrphan(LocalDateTime.now());
                if (simulationRunRepository.updateIfRunning(run)) {
                    recovered++;
                    touchedQueues.add(run.getQueueId());
                }
            } catch (Exception ex) {
                log.warn("Failed to recover orphaned run. runId={}, error={}", runId, ex.getMessage());
            }
        }
        for (Long queueId : touchedQueues) {
            queueStatusApplicationService.refreshRollup(queueId);
        }
        log.info("Orphaned runs recovered. requested={}, recovered={}, queues={}", runIds.size(), recovered, touchedQueues);
        return recovered;
    }
}
