package com.dealsim.domain.queue.service;

import com.dealsim.domain.queue.model.entity.SimulationQueueEntity;
import com.dealsim.domain.run.model.entity.SimulationRunEntity;
import com.dealsim.types.common.Constants;
import com.dealsim.types.enums.QueueStatusEnum;
import com.dealsim.types.enums.RunStatusEnum;
import com.dealsim.types.enums.ZopaDistanceEnum;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Run matrix builder: expands technique x tactic x personality x distance into an ordered run list.
 */
@Service
public class RunMatrixDomainService {

    /**
     * Resolves the personality selector against the catalog. "all" means the whole catalog as of now.
     */
    public List<String> resolvePersonalities(List<String> selector, List<String> catalogIds, String defaultPersonality) {
        return resolve(selector, catalogIds, defaultPersonality, Constants.DEFAULT_PERSONALITY);
    }

    /**
     * Resolves the distance selector against the close/medium/far catalog.
     */
    public List<String> resolveDistances(List<String> selector, String defaultDistance) {
        return resolve(selector, ZopaDistanceEnum.allCodes(), defaultDistance, Constants.DEFAULT_DISTANCE);
    }

    public SimulationQueueEntity buildQueue(Long negotiationId, int totalSimulations, BigDecimal costPerRun, LocalDateTime now) {
        SimulationQueueEntity queue = new SimulationQueueEntity();
        queue.setNegotiationId(negotiationId);
        queue.setTotalSimulations(totalSimulations);
        queue.setPriority(0);
        queue.setStatus(QueueStatusEnum.PENDING);
        queue.setCompletedCount(0);
        queue.setFailedCount(0);
        queue.setEstimatedTotalCost(costPerRun.multiply(BigDecimal.valueOf(totalSimulations))
                .setScale(4, RoundingMode.HALF_UP));
        queue.setActualTotalCost(BigDecimal.ZERO);
        queue.setMetadata(new HashMap<>());
        queue.setCreatedAt(now);
        queue.setUpdatedAt(now);
        queue.validate();
        return queue;
    }

    /**
     * Cross product nested technique, tactic, personality, distance; execution order 1..N in that order.
     */
    public List<SimulationRunEntity> buildRuns(SimulationQueueEntity queue,
                                               List<Long> techniqueIds,
                                               List<Long> tacticIds,
                                               List<String> personalities,
                                               List<String> distances,
                                               int maxRetries) {
        List<List<Object>> combinations = Lists.cartesianProduct(
                ImmutableList.<Object>copyOf(techniqueIds),
                ImmutableList.<Object>copyOf(tacticIds),
                ImmutableList.<Object>copyOf(personalities),
                ImmutableList.<Object>copyOf(distances));
        List<SimulationRunEntity> runs = new ArrayList<>(combinations.size());
        int order = 0;
        for (List<Object> combination : combinations) {
            order++;
            SimulationRunEntity run = new SimulationRunEntity();
            run.setQueueId(queue.getId());
            run.setNegotiationId(queue.getNegotiationId());
            run.setRunNumber(order);
            run.setExecutionOrder(order);
            run.setTechniqueId((Long) combination.get(0));
            run.setTacticId((Long) combination.get(1));
            run.setPersonalityId((String) combination.get(2));
            run.setZopaDistance((String) combination.get(3));
            run.setStatus(RunStatusEnum.PENDING);
            run.setRetryCount(0);
            run.setMaxRetries(maxRetries);
            run.setActualCost(BigDecimal.ZERO);
            run.setTotalRounds(0);
            run.setMetadata(new HashMap<>());
            run.setCreatedAt(queue.getCreatedAt());
            run.setUpdatedAt(queue.getCreatedAt());
            run.validate();
            runs.add(run);
        }
        return runs;
    }

    public int matrixSize(List<Long> techniqueIds, List<Long> tacticIds, List<String> personalities, List<String> distances) {
        return techniqueIds.size() * tacticIds.size() * personalities.size() * distances.size();
    }

    private List<String> resolve(List<String> selector, List<String> catalog, String configuredDefault, String fallback) {
        Set<String> resolved = new LinkedHashSet<>();
        if (selector != null) {
            boolean all = selector.stream().anyMatch(s -> Constants.ALL_SELECTOR.equalsIgnoreCase(StringUtils.trim(s)));
            if (all) {
                if (catalog != null) {
                    catalog.stream().filter(StringUtils::isNotBlank).forEach(resolved::add);
                }
            } else {
                selector.stream().filter(StringUtils::isNotBlank).map(String::trim).forEach(resolved::add);
            }
        }
        if (resolved.isEmpty()) {
            resolved.add(StringUtils.defaultIfBlank(configuredDefault, fallback));
        }
        return new ArrayList<>(resolved);
    }
}
