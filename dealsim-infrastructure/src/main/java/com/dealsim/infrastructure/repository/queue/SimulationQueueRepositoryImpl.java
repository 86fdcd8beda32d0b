package com.dealsim.infrastructure.repository.queue;

import com.dealsim.domain.queue.adapter.repository.ISimulationQueueRepository;
import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.queue.model.valobj.QueueRunStats;
import com.dealsim.infrastructure.dao.SimulationQueueDao;
import com.dealsim.infrastructure.dao.po.SimulationQueuePO;
import com.dealsim.infrastructure.util.JsonCodec;
import com.dealsim.types.enums.QueueStatusEnum;
import com.dealsim.types.enums.ResponseCode;
import com.dealsim.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Simulation queue repository implementation.
 * <p>
 * Status writes and rollup writes touch disjoint columns so the executor, the reaper and
 * operator commands never overwrite each other's fields. Status writes are compare-and-set
 * on the status column.
 * </p>
 *
 * @author dealsim
 * @since 2026-03-02
 */
@Slf4j
@Repository
public class SimulationQueueRepositoryImpl implements ISimulationQueueRepository {

    private final SimulationQueueDao simulationQueueDao;
    private final JsonCodec jsonCodec;

    public SimulationQueueRepositoryImpl(SimulationQueueDao simulationQueueDao, JsonCodec jsonCodec) {
        this.simulationQueueDao = simulationQueueDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public SimulationQueueEntity save(SimulationQueueEntity entity) {
        entity.validate();
        SimulationQueuePO po = toPO(entity);
        simulationQueueDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public SimulationQueueEntity findById(Long id) {
        return toEntity(simulationQueueDao.selectById(id));
    }

    @Override
    public List<SimulationQueueEntity> findByNegotiationId(Long negotiationId) {
        return simulationQueueDao.selectByNegotiationId(negotiationId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public SimulationQueueEntity findActiveByNegotiationId(Long negotiationId) {
        return toEntity(simulationQueueDao.selectLatestActiveByNegotiationId(negotiationId));
    }

    @Override
    public List<SimulationQueueEntity> findByStatuses(List<QueueStatusEnum> statuses) {
        List<String> codes = statuses.stream().map(QueueStatusEnum::getCode).collect(Collectors.toList());
        return simulationQueueDao.selectByStatuses(codes).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public boolean updateStatus(SimulationQueueEntity entity, QueueStatusEnum expected) {
        if (entity.getUpdatedAt() == null) {
            entity.setUpdatedAt(LocalDateTime.now());
        }
        int affected = simulationQueueDao.updateStatus(toPO(entity), expected == null ? null : expected.getCode());
        if (affected > 0) {
            return true;
        }
        if (simulationQueueDao.selectById(entity.getId()) == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Simulation queue not found: " + entity.getId());
        }
        return false;
    }

    @Override
    public void updateRollup(Long queueId, QueueRunStats stats) {
        int affected = simulationQueueDao.updateRollup(queueId,
                stats.getCompletedCount(),
                stats.getFailedCount(),
                stats.getTotalCost(),
                LocalDateTime.now());
        if (affected == 0) {
            log.warn("Queue rollup update matched no row. queueId={}", queueId);
        }
    }

    private SimulationQueueEntity toEntity(SimulationQueuePO po) {
        if (po == null) {
            return null;
        }
        SimulationQueueEntity entity = new SimulationQueueEntity();
        entity.setId(po.getId());
        entity.setNegotiationId(po.getNegotiationId());
        entity.setTotalSimulations(po.getTotalSimulations());
        entity.setPriority(po.getPriority());
        entity.setStatus(QueueStatusEnum.fromCode(po.getStatus()));
        entity.setCompletedCount(po.getCompletedCount());
        entity.setFailedCount(po.getFailedCount());
        entity.setEstimatedTotalCost(po.getEstimatedTotalCost());
        entity.setActualTotalCost(po.getActualTotalCost());
        entity.setLastError(po.getLastError());
        Map<String, Object> metadata = jsonCodec.readMap(po.getMetadata());
        entity.setMetadata(metadata == null ? new HashMap<>() : metadata);
        entity.setCreatedAt(po.getCreatedAt());
        entity.setStartedAt(po.getStartedAt());
        entity.setPausedAt(po.getPausedAt());
        entity.setCompletedAt(po.getCompletedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private SimulationQueuePO toPO(SimulationQueueEntity entity) {
        return SimulationQueuePO.builder()
                .id(entity.getId())
                .negotiationId(entity.getNegotiationId())
                .totalSimulations(entity.getTotalSimulations())
                .priority(entity.getPriority())
                .status(entity.getStatus() == null ? null : entity.getStatus().getCode())
                .completedCount(entity.getCompletedCount())
                .failedCount(entity.getFailedCount())
                .estimatedTotalCost(entity.getEstimatedTotalCost())
                .actualTotalCost(entity.getActualTotalCost())
                .lastError(entity.getLastError())
                .metadata(jsonCodec.writeValue(entity.getMetadata()))
                .createdAt(entity.getCreatedAt())
                .startedAt(entity.getStartedAt())
                .pausedAt(entity.getPausedAt())
                .completedAt(entity.getCompletedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
