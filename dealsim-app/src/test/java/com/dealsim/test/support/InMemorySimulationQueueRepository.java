package com.dealsim.test.support;

import com.dealsim.domain.queue.adapter.repository.ISimulationQueueRepository;
import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.queue.model.valobj.QueueRunStats;
import com.dealsim.types.enums.QueueStatusEnum;
import com.dealsim.types.enums.ResponseCode;
import com.dealsim.types.exception.AppException;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * In-memory queue store.
 */
public class InMemorySimulationQueueRepository implements ISimulationQueueRepository {

    private final Map<Long, SimulationQueueEntity> store = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized SimulationQueueEntity save(SimulationQueueEntity entity) {
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        store.put(entity.getId(), copy(entity));
        return entity;
    }

    @Override
    public synchronized SimulationQueueEntity findById(Long id) {
        SimulationQueueEntity stored = store.get(id);
        return stored == null ? null : copy(stored);
    }

    @Override
    public synchronized List<SimulationQueueEntity> findByNegotiationId(Long negotiationId) {
        return store.values().stream()
                .filter(queue -> negotiationId.equals(queue.getNegotiationId()))
                .sorted(Comparator.comparing(SimulationQueueEntity::getId).reversed())
                .map(InMemorySimulationQueueRepository::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized SimulationQueueEntity findActiveByNegotiationId(Long negotiationId) {
        return findByNegotiationId(negotiationId).stream()
                .filter(queue -> queue.getStatus() == QueueStatusEnum.PENDING || queue.getStatus() == QueueStatusEnum.RUNNING)
                .findFirst()
                .orElse(null);
    }

    @Override
    public synchronized List<SimulationQueueEntity> findByStatuses(List<QueueStatusEnum> statuses) {
        return store.values().stream()
                .filter(queue -> statuses.contains(queue.getStatus()))
                .map(InMemorySimulationQueueRepository::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean updateStatus(SimulationQueueEntity entity, QueueStatusEnum expected) {
        SimulationQueueEntity stored = store.get(entity.getId());
        if (stored == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Simulation queue not found: " + entity.getId());
        }
        if (stored.getStatus() != expected) {
            return false;
        }
        stored.setStatus(entity.getStatus());
        stored.setLastError(entity.getLastError());
        stored.setStartedAt(entity.getStartedAt());
        stored.setPausedAt(entity.getPausedAt());
        stored.setCompletedAt(entity.getCompletedAt());
        stored.setUpdatedAt(entity.getUpdatedAt());
        return true;
    }

    @Override
    public synchronized void updateRollup(Long queueId, QueueRunStats stats) {
        SimulationQueueEntity stored = store.get(queueId);
        if (stored != null) {
            stored.applyRollup(stats);
        }
    }

    static SimulationQueueEntity copy(SimulationQueueEntity source) {
        SimulationQueueEntity target = new SimulationQueueEntity();
        target.setId(source.getId());
        target.setNegotiationId(source.getNegotiationId());
        target.setTotalSimulations(source.getTotalSimulations());
        target.setPriority(source.getPriority());
        target.setStatus(source.getStatus());
        target.setCompletedCount(source.getCompletedCount());
        target.setFailedCount(source.getFailedCount());
        target.setEstimatedTotalCost(source.getEstimatedTotalCost());
        target.setActualTotalCost(source.getActualTotalCost());
        target.setLastError(source.getLastError());
        target.setMetadata(source.getMetadata() == null ? null : new HashMap<>(source.getMetadata()));
        target.setCreatedAt(source.getCreatedAt());
        target.setStartedAt(source.getStartedAt());
        target.setPausedAt(source.getPausedAt());
        target.setCompletedAt(source.getCompletedAt());
        target.setUpdatedAt(source.getUpdatedAt());
        return target;
    }
}
