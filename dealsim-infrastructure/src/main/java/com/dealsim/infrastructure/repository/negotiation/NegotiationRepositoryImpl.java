package com.dealsim.infrastructure.repository.negotiation;

import com.dealsim.domain.negotiation.adapter.repository.INegotiationRepository;
import com.dealsim.domain.negotiation.model.entity.NegotiationEntity;
import com.dealsim.domain.result.model.valobj.DimensionDefinition;
import com.dealsim.infrastructure.dao.NegotiationDao;
import com.dealsim.infrastructure.dao.po.NegotiationPO;
import com.dealsim.infrastructure.util.JsonCodec;
import com.dealsim.types.enums.NegotiationStatusEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Negotiation repository implementation. Reads the scenario JSONB for role and dimensions.
 */
@Repository
public class NegotiationRepositoryImpl implements INegotiationRepository {

    private final NegotiationDao negotiationDao;
    private final JsonCodec jsonCodec;

    public NegotiationRepositoryImpl(NegotiationDao negotiationDao, JsonCodec jsonCodec) {
        this.negotiationDao = negotiationDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public NegotiationEntity findById(Long id) {
        NegotiationPO po = negotiationDao.selectById(id);
        if (po == null) {
            return null;
        }
        NegotiationEntity entity = new NegotiationEntity();
        entity.setId(po.getId());
        entity.setTitle(po.getTitle());
        entity.setStatus(StringUtils.isBlank(po.getStatus()) ? null : NegotiationStatusEnum.fromCode(po.getStatus()));
        entity.setStartedAt(po.getStartedAt());
        entity.setEndedAt(po.getEndedAt());

        Map<String, Object> scenario = jsonCodec.readMap(po.getScenario());
        if (scenario != null) {
            Object role = scenario.get("userRole");
            entity.setUserRole(role == null ? null : String.valueOf(role));
            entity.setDimensions(readDimensions(scenario.get("dimensions")));
        }
        return entity;
    }

    @Override
    public boolean updateStatus(Long id, NegotiationStatusEnum status) {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime startedAt = status == NegotiationStatusEnum.RUNNING ? now : null;
        LocalDateTime endedAt = status == NegotiationStatusEnum.COMPLETED || status == NegotiationStatusEnum.ABORTED
                ? now : null;
        return negotiationDao.updateStatus(id, status.getCode(), startedAt, endedAt) > 0;
    }

    private List<DimensionDefinition> readDimensions(Object raw) {
        List<DimensionDefinition> dimensions = new ArrayList<>();
        if (!(raw instanceof List)) {
            return dimensions;
        }
        for (Object item : (List<?>) raw) {
            if (!(item instanceof Map)) {
                continue;
            }
            Map<?, ?> map = (Map<?, ?>) item;
            Object priority = map.get("priority");
            dimensions.add(DimensionDefinition.builder()
                    .name(map.get("name") == null ? "" : String.valueOf(map.get("name")))
                    .targetValue(map.get("targetValue"))
                    .minValue(map.get("minValue"))
                    .maxValue(map.get("maxValue"))
                    .priority(priority instanceof Number ? ((Number) priority).intValue() : null)
                    .build());
        }
        return dimensions;
    }
}
