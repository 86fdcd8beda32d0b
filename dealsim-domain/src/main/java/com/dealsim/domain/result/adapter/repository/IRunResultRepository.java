package com.dealsim.domain.result.adapter.repository;

import com.dealsim.domain.result.model.entity.DimensionResultEntity;
import com.dealsim.domain.result.model.entity.ProductResultEntity;

import java.util.List;

/**
 * Per-run dimension and product result rows.
 */
public interface IRunResultRepository {

    /**
     * Deletes the existing rows of the run and inserts the given ones.
     */
    void replaceForRun(Long runId, List<DimensionResultEntity> dimensionRows, List<ProductResultEntity> productRows);

    List<DimensionResultEntity> findDimensionResultsByRunId(Long runId);

    List<ProductResultEntity> findProductResultsByRunId(Long runId);
}
