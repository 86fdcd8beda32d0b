package com.dealsim.domain.queue.adapter.repository;

import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.queue.model.valobj.QueueRunStats;
import com.dealsim.types.enums.QueueStatusEnum;

import java.util.List;

/**
 * Simulation queue repository.
 *
 * @author dealsim
 * @since 2026-03-02
 */
public interface ISimulationQueueRepository {

    /**
     * Inserts a new queue and assigns its id.
     */
    SimulationQueueEntity save(SimulationQueueEntity entity);

    SimulationQueueEntity findById(Long id);

    /**
     * Newest first.
     */
    List<SimulationQueueEntity> findByNegotiationId(Long negotiationId);

    /**
     * Latest pending or running queue of a negotiation, null when none.
     */
    SimulationQueueEntity findActiveByNegotiationId(Long negotiationId);

    List<SimulationQueueEntity> findByStatuses(List<QueueStatusEnum> statuses);

    /**
     * Writes status, timestamps and last error only, and only while the stored status still
     * equals {@code expected}. Throws when the queue does not exist.
     *
     * @return false when another writer moved the queue first
     */
    boolean updateStatus(SimulationQueueEntity entity, QueueStatusEnum expected);

    /**
     * Writes the cached counters and actual cost.
     */
    void updateRollup(Long queueId, QueueRunStats stats);
}
