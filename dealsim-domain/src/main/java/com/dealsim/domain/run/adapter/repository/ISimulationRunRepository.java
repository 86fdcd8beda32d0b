package com.dealsim.domain.run.adapter.repository;

import com.dealsim.domain.queue.model.valobj.QueueRunStats;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.domain.run.model.valobj.RunClaimResult;
import com.dealsim.types.enums.RunStatusEnum;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Simulation run repository.
 *
 * @author dealsim
 * @since 2026-03-02
 */
public interface ISimulationRunRepository {

    /**
     * Inserts the runs of a new queue.
     */
    List<SimulationRunEntity> batchSave(List<SimulationRunEntity> entities);

    SimulationRunEntity findById(Long id);

    /**
     * Ordered by execution order.
     */
    List<SimulationRunEntity> findByQueueId(Long queueId);

    List<SimulationRunEntity> findByQueueIdAndStatuses(Long queueId, List<RunStatusEnum> statuses);

    List<SimulationRunEntity> findByNegotiationId(Long negotiationId);

    /**
     * Current status straight from storage, null when the run does not exist.
     */
    RunStatusEnum findStatus(Long id);

    /**
     * Atomically claims the pending run with the smallest execution order. Holds the queue row
     * lock, so a second claim for the same queue reports AT_CAPACITY while a run is running.
     */
    RunClaimResult claimNextPending(Long queueId, LocalDateTime now);

    /**
     * Writes the run state only if the stored status still equals {@code expected}.
     *
     * @return false when the row moved on in the meantime
     */
    boolean updateIfStatus(SimulationRunEntity entity, RunStatusEnum expected);

    /**
     * Conditional write used after an engine call; a concurrent stop wins.
     */
    default boolean updateIfRunning(SimulationRunEntity entity) {
        return updateIfStatus(entity, RunStatusEnum.RUNNING);
    }

    /**
     * Unconditional write of deal value, other dimensions and metadata.
     */
    void updateArtifacts(SimulationRunEntity entity);

    /**
     * Moves every running run started before {@code threshold} to TIMEOUT in one statement.
     *
     * @return the runs that were reaped by this call
     */
    List<SimulationRunEntity> markStaleRunningAsTimeout(LocalDateTime threshold, LocalDateTime now);

    /**
     * Running runs of a negotiation started before {@code threshold}, newest start first.
     */
    List<SimulationRunEntity> findStaleRunning(Long negotiationId, LocalDateTime threshold);

    /**
     * Moves every pending or running run of the queue to ABORTED.
     *
     * @return the aborted runs, with their previous status lost
     */
    List<SimulationRunEntity> abortActive(Long queueId, LocalDateTime now);

    QueueRunStats summarize(Long queueId);
}
