package com.dealsim.infrastructure.repository.result;

import com.dealsim.domain.result.adapter.repository.IRunResultRepository;
import com.dealsim.domain.result.model.entity.DimensionResultEntity;
import com.dealsim.domain.result.model.entity.ProductResultEntity;
import com.dealsim.infrastructure.dao.DimensionResultDao;
import com.dealsim.infrastructure.dao.ProductResultDao;
import com.dealsim.infrastructure.dao.po.DimensionResultPO;
import com.dealsim.infrastructure.dao.po.ProductResultPO;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Dimension and product result rows, replaced as a whole per run.
 */
@Repository
public class RunResultRepositoryImpl implements IRunResultRepository {

    private final DimensionResultDao dimensionResultDao;
    private final ProductResultDao productResultDao;

    public RunResultRepositoryImpl(DimensionResultDao dimensionResultDao, ProductResultDao productResultDao) {
        this.dimensionResultDao = dimensionResultDao;
        this.productResultDao = productResultDao;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void replaceForRun(Long runId, List<DimensionResultEntity> dimensionRows, List<ProductResultEntity> productRows) {
        dimensionResultDao.deleteByRunId(runId);
        productResultDao.deleteByRunId(runId);
        if (dimensionRows != null && !dimensionRows.isEmpty()) {
            dimensionResultDao.batchInsert(dimensionRows.stream()
                    .map(row -> toPO(runId, row))
                    .collect(Collectors.toList()));
        }
        if (productRows != null && !productRows.isEmpty()) {
            productResultDao.batchInsert(productRows.stream()
                    .map(row -> toPO(runId, row))
                    .collect(Collectors.toList()));
        }
    }

    @Override
    public List<DimensionResultEntity> findDimensionResultsByRunId(Long runId) {
        return dimensionResultDao.selectByRunId(runId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<ProductResultEntity> findProductResultsByRunId(Long runId) {
        return productResultDao.selectByRunId(runId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private DimensionResultPO toPO(Long runId, DimensionResultEntity entity) {
        return DimensionResultPO.builder()
                .runId(runId)
                .dimensionName(entity.getDimensionName())
                .finalValue(entity.getFinalValue())
                .targetValue(entity.getTargetValue())
                .achievedTarget(entity.getAchievedTarget())
                .priorityScore(entity.getPriorityScore())
                .build();
    }

    private ProductResultPO toPO(Long runId, ProductResultEntity entity) {
        return ProductResultPO.builder()
                .runId(runId)
                .productId(entity.getProductId())
                .productName(entity.getProductName())
                .targetPrice(entity.getTargetPrice())
                .minMaxPrice(entity.getMinMaxPrice())
                .estimatedVolume(entity.getEstimatedVolume())
                .agreedPrice(entity.getAgreedPrice())
                .priceVsTarget(entity.getPriceVsTarget())
                .absoluteDeltaFromTarget(entity.getAbsoluteDeltaFromTarget())
                .priceVsMinMax(entity.getPriceVsMinMax())
                .absoluteDeltaFromMinMax(entity.getAbsoluteDeltaFromMinMax())
                .withinZopa(entity.getWithinZopa())
                .zopaUtilization(entity.getZopaUtilization())
                .subtotal(entity.getSubtotal())
                .targetSubtotal(entity.getTargetSubtotal())
                .deltaFromTargetSubtotal(entity.getDeltaFromTargetSubtotal())
                .performanceScore(entity.getPerformanceScore())
                .dimensionKey(entity.getDimensionKey())
                .build();
    }

    private DimensionResultEntity toEntity(DimensionResultPO po) {
        return DimensionResultEntity.builder()
                .id(po.getId())
                .runId(po.getRunId())
                .dimensionName(po.getDimensionName())
                .finalValue(po.getFinalValue())
                .targetValue(po.getTargetValue())
                .achievedTarget(po.getAchievedTarget())
                .priorityScore(po.getPriorityScore())
                .build();
    }

    private ProductResultEntity toEntity(ProductResultPO po) {
        return ProductResultEntity.builder()
                .id(po.getId())
                .runId(po.getRunId())
                .productId(po.getProductId())
                .productName(po.getProductName())
                .targetPrice(po.getTargetPrice())
                .minMaxPrice(po.getMinMaxPrice())
                .estimatedVolume(po.getEstimatedVolume())
                .agreedPrice(po.getAgreedPrice())
                .priceVsTarget(po.getPriceVsTarget())
                .absoluteDeltaFromTarget(po.getAbsoluteDeltaFromTarget())
                .priceVsMinMax(po.getPriceVsMinMax())
                .absoluteDeltaFromMinMax(po.getAbsoluteDeltaFromMinMax())
                .withinZopa(po.getWithinZopa())
                .zopaUtilization(po.getZopaUtilization())
                .subtotal(po.getSubtotal())
                .targetSubtotal(po.getTargetSubtotal())
                .deltaFromTargetSubtotal(po.getDeltaFromTargetSubtotal())
                .performanceScore(po.getPerformanceScore())
                .dimensionKey(po.getDimensionKey())
                .build();
    }
}
