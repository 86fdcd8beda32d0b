package com.dealsim.infrastructure.repository.run;

import com.dealsim.domain.queue.model.valobj.QueueRunStats;
import com.dealsim.domain.run.adapter.repository.ISimulationRunRepository;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.domain.run.model.valobj.RunClaimResult;
import com.dealsim.infrastructure.dao.SimulationQueueDao;
import com.dealsim.infrastructure.dao.SimulationRunDao;
import com.dealsim.infrastructure.dao.po.RunStatusStatPO;
import com.dealsim.infrastructure.dao.po.SimulationRunPO;
import com.dealsim.infrastructure.util.JsonCodec;
import com.dealsim.types.enums.RunStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Simulation run repository implementation.
 * <p>
 * The claim holds the queue row lock while it checks for a running run and picks the next
 * pending one with {@code FOR UPDATE SKIP LOCKED}, so two claimers of one queue serialize.
 * </p>
 *
 * @author dealsim
 * @since 2026-03-02
 */
@Slf4j
@Repository
public class SimulationRunRepositoryImpl implements ISimulationRunRepository {

    private final SimulationRunDao simulationRunDao;
    private final SimulationQueueDao simulationQueueDao;
    private final JsonCodec jsonCodec;

    public SimulationRunRepositoryImpl(SimulationRunDao simulationRunDao,
                                       SimulationQueueDao simulationQueueDao,
                                       JsonCodec jsonCodec) {
        this.simulationRunDao = simulationRunDao;
        this.simulationQueueDao = simulationQueueDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public List<SimulationRunEntity> batchSave(List<SimulationRunEntity> entities) {
        if (entities == null || entities.isEmpty()) {
            return new ArrayList<>();
        }
        entities.forEach(SimulationRunEntity::validate);
        List<SimulationRunPO> pos = entities.stream().map(this::toPO).collect(Collectors.toList());
        simulationRunDao.batchInsert(pos);
        for (int i = 0; i < entities.size(); i++) {
            entities.get(i).setId(pos.get(i).getId());
        }
        return entities;
    }

    @Override
    public SimulationRunEntity findById(Long id) {
        return toEntity(simulationRunDao.selectById(id));
    }

    @Override
    public List<SimulationRunEntity> findByQueueId(Long queueId) {
        return toEntities(simulationRunDao.selectByQueueId(queueId));
    }

    @Override
    public List<SimulationRunEntity> findByQueueIdAndStatuses(Long queueId, List<RunStatusEnum> statuses) {
        return toEntities(simulationRunDao.selectByQueueIdAndStatuses(queueId, codes(statuses)));
    }

    @Override
    public List<SimulationRunEntity> findByNegotiationId(Long negotiationId) {
        return toEntities(simulationRunDao.selectByNegotiationId(negotiationId));
    }

    @Override
    public RunStatusEnum findStatus(Long id) {
        return RunStatusEnum.fromCode(simulationRunDao.selectStatusById(id));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public RunClaimResult claimNextPending(Long queueId, LocalDateTime now) {
        if (simulationQueueDao.lockById(queueId) == null) {
            return RunClaimResult.none();
        }
        if (simulationRunDao.countByQueueIdAndStatus(queueId, RunStatusEnum.RUNNING.getCode()) > 0) {
            return RunClaimResult.atCapacity();
        }
        SimulationRunPO next = simulationRunDao.selectNextPendingForUpdate(queueId);
        if (next == null) {
            return RunClaimResult.none();
        }
        SimulationRunEntity run = toEntity(next);
        run.claim(now);
        int affected = simulationRunDao.updateStateIfStatus(toPO(run), RunStatusEnum.PENDING.getCode());
        if (affected == 0) {
            log.warn("Run claim lost. queueId={}, runId={}", queueId, run.getId());
            return RunClaimResult.atCapacity();
        }
        return RunClaimResult.claimed(run);
    }

    @Override
    public boolean updateIfStatus(SimulationRunEntity entity, RunStatusEnum expected) {
        if (entity.getUpdatedAt() == null) {
            entity.setUpdatedAt(LocalDateTime.now());
        }
        return simulationRunDao.updateStateIfStatus(toPO(entity), expected.getCode()) > 0;
    }

    @Override
    public void updateArtifacts(SimulationRunEntity entity) {
        simulationRunDao.updateArtifacts(toPO(entity));
    }

    @Override
    public List<SimulationRunEntity> markStaleRunningAsTimeout(LocalDateTime threshold, LocalDateTime now) {
        return toEntities(simulationRunDao.markStaleRunningAsTimeout(threshold, now));
    }

    @Override
    public List<SimulationRunEntity> findStaleRunning(Long negotiationId, LocalDateTime threshold) {
        return toEntities(simulationRunDao.selectStaleRunning(negotiationId, threshold));
    }

    @Override
    public List<SimulationRunEntity> abortActive(Long queueId, LocalDateTime now) {
        return toEntities(simulationRunDao.abortActive(queueId, now));
    }

    @Override
    public QueueRunStats summarize(Long queueId) {
        Map<RunStatusEnum, Integer> counts = new EnumMap<>(RunStatusEnum.class);
        BigDecimal totalCost = BigDecimal.ZERO;
        for (RunStatusStatPO stat : simulationRunDao.summarizeByQueueId(queueId)) {
            RunStatusEnum status = RunStatusEnum.fromCode(stat.getStatus());
            counts.put(status, stat.getTotal() == null ? 0 : stat.getTotal());
            if (stat.getTotalCost() != null) {
                totalCost = totalCost.add(stat.getTotalCost());
            }
        }
        return QueueRunStats.builder()
                .queueId(queueId)
                .countsByStatus(counts)
                .totalCost(totalCost)
                .build();
    }

    private List<String> codes(List<RunStatusEnum> statuses) {
        return statuses.stream().map(RunStatusEnum::getCode).collect(Collectors.toList());
    }

    private List<SimulationRunEntity> toEntities(List<SimulationRunPO> pos) {
        if (pos == null) {
            return new ArrayList<>();
        }
        return pos.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private SimulationRunEntity toEntity(SimulationRunPO po) {
        if (po == null) {
            return null;
        }
        SimulationRunEntity entity = new SimulationRunEntity();
        entity.setId(po.getId());
        entity.setQueueId(po.getQueueId());
        entity.setNegotiationId(po.getNegotiationId());
        entity.setRunNumber(po.getRunNumber());
        entity.setExecutionOrder(po.getExecutionOrder());
        entity.setTechniqueId(po.getTechniqueId());
        entity.setTacticId(po.getTacticId());
        entity.setPersonalityId(po.getPersonalityId());
        entity.setZopaDistance(po.getZopaDistance());
        entity.setStatus(RunStatusEnum.fromCode(po.getStatus()));
        entity.setRetryCount(po.getRetryCount());
        entity.setMaxRetries(po.getMaxRetries());
        entity.setStartedAt(po.getStartedAt());
        entity.setCompletedAt(po.getCompletedAt());

        // JSONB
        List<Map<String, Object>> conversationLog = jsonCodec.readMapList(po.getConversationLog());
        entity.setConversationLog(conversationLog == null ? new ArrayList<>() : conversationLog);
        Map<String, Object> otherDimensions = jsonCodec.readMap(po.getOtherDimensions());
        entity.setOtherDimensions(otherDimensions == null ? new LinkedHashMap<>() : otherDimensions);
        Map<String, Object> metadata = jsonCodec.readMap(po.getMetadata());
        entity.setMetadata(metadata == null ? new HashMap<>() : metadata);

        entity.setDealValue(po.getDealValue());
        entity.setActualCost(po.getActualCost());
        entity.setOutcome(po.getOutcome());
        entity.setOutcomeReason(po.getOutcomeReason());
        entity.setTotalRounds(po.getTotalRounds());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private SimulationRunPO toPO(SimulationRunEntity entity) {
        return SimulationRunPO.builder()
                .id(entity.getId())
                .queueId(entity.getQueueId())
                .negotiationId(entity.getNegotiationId())
                .runNumber(entity.getRunNumber())
                .executionOrder(entity.getExecutionOrder())
                .techniqueId(entity.getTechniqueId())
                .tacticId(entity.getTacticId())
                .personalityId(entity.getPersonalityId())
                .zopaDistance(entity.getZopaDistance())
                .status(entity.getStatus() == null ? null : entity.getStatus().getCode())
                .retryCount(entity.getRetryCount())
                .maxRetries(entity.getMaxRetries())
                .startedAt(entity.getStartedAt())
                .completedAt(entity.getCompletedAt())
                .conversationLog(jsonCodec.writeValue(entity.getConversationLog()))
                .otherDimensions(jsonCodec.writeValue(entity.getOtherDimensions()))
                .dealValue(entity.getDealValue())
                .actualCost(entity.getActualCost())
                .outcome(entity.getOutcome())
                .outcomeReason(entity.getOutcomeReason())
                .totalRounds(entity.getTotalRounds())
                .metadata(jsonCodec.writeValue(entity.getMetadata()))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
