package com.dealsim.test.support;

import com.dealsim.domain.result.adapter.repository.IRunResultRepository;
import com.dealsim.domain.result.model.entity.DimensionResultEntity;
import com.dealsim.domain.result.model.entity.ProductResultEntity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory dimension and product result rows.
 */
public class InMemoryRunResultRepository implements IRunResultRepository {

    private final Map<Long, List<DimensionResultEntity>> dimensions = new ConcurrentHashMap<>();
    private final Map<Long, List<ProductResultEntity>> products = new ConcurrentHashMap<>();

    @Override
    public void replaceForRun(Long runId, List<DimensionResultEntity> dimensionRows, List<ProductResultEntity> productRows) {
        dimensions.put(runId, dimensionRows == null ? new ArrayList<>() : new ArrayList<>(dimensionRows));
        products.put(runId, productRows == null ? new ArrayList<>() : new ArrayList<>(productRows));
    }

    @Override
    public List<DimensionResultEntity> findDimensionResultsByRunId(Long runId) {
        return dimensions.getOrDefault(runId, Collections.emptyList());
    }

    @Override
    public List<ProductResultEntity> findProductResultsByRunId(Long runId) {
        return products.getOrDefault(runId, Collections.emptyList());
    }
}
