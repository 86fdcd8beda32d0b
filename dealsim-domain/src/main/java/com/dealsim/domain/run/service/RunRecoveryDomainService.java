package com.dealsim.domain.run.service;

import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.domain.run.model.valobj.RecoveryOpportunity;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds crash-recovery snapshots from orphaned running runs.
 */
@Service
public class RunRecoveryDomainService {

    public RecoveryOpportunity describe(Long latestQueueId, List<SimulationRunEntity> orphans) {
        if (orphans == null || orphans.isEmpty()) {
            return RecoveryOpportunity.builder()
                    .hasRecoverableSession(false)
                    .queueId(latestQueueId)
                    .build();
        }
        SimulationRunEntity latest = orphans.stream()
                .filter(run -> run.getStartedAt() != null)
                .max(Comparator.comparing(SimulationRunEntity::getStartedAt))
                .orElse(orphans.get(0));
        List<Long> ids = orphans.stream()
                .map(SimulationRunEntity::getId)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        return RecoveryOpportunity.builder()
                .hasRecoverableSession(true)
                .queueId(latestQueueId)
                .checkpoint(latest.getCheckpoint())
                .orphanedSimulations(ids)
                .build();
    }
}
