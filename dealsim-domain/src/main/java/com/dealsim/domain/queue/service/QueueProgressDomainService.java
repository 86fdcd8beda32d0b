package com.dealsim.domain.queue.service;

import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.queue.model.valobj.CurrentRunView;
import com.dealsim.domain.queue.model.valobj.QueueProgressView;
import com.dealsim.domain.queue.model.valobj.QueueRunStats;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.types.enums.RunStatusEnum;
import org.springframework.stereotype.Service;

/**
 * Derives queue progress from run counts.
 */
@Service
public class QueueProgressDomainService {

    public QueueProgressView buildView(SimulationQueueEntity queue,
                                       QueueRunStats stats,
                                       SimulationRunEntity runningRun,
                                       long averageRunSeconds) {
        int total = queue.getTotalSimulations() == null ? 0 : queue.getTotalSimulations();
        int completed = stats.getCompletedCount();
        int failed = stats.getFailedCount();
        int finished = completed + failed;
        int progress = total > 0 ? (int) Math.round(finished * 100D / total) : 0;
        long remaining = Math.max(0, total - finished);

        CurrentRunView current = null;
        if (runningRun != null) {
            current = CurrentRunView.builder()
                    .runId(runningRun.getId())
                    .runNumber(runningRun.getRunNumber())
                    .techniqueId(runningRun.getTechniqueId())
                    .tacticId(runningRun.getTacticId())
                    .startedAt(runningRun.getStartedAt())
                    .build();
        }

        return QueueProgressView.builder()
                .queueId(queue.getId())
                .negotiationId(queue.getNegotiationId())
                .status(queue.getStatus())
                .totalSimulations(total)
                .completedCount(completed)
                .failedCount(failed)
                .pendingCount(stats.getPendingCount())
                .runningCount(stats.getRunningCount())
                .pausedCount(stats.count(RunStatusEnum.PAUSED))
                .abortedCount(stats.count(RunStatusEnum.ABORTED))
                .progressPercentage(progress)
                .estimatedTimeRemaining(remaining * averageRunSeconds)
                .currentSimulation(current)
                .actualCost(stats.getTotalCost())
                .estimatedCost(queue.getEstimatedTotalCost())
                .build();
    }

    /**
     * Completed plus failed-like runs reached the queue size.
     */
    public boolean isFinished(SimulationQueueEntity queue, QueueRunStats stats) {
        return queue.isFinished(stats);
    }
}
