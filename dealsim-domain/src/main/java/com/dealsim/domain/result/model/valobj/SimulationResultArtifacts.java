package com.dealsim.domain.result.model.valobj;

import com.dealsim.domain.result.model.entity.DimensionResultEntity;
import com.dealsim.domain.result.model.entity.ProductResultEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derived result of one run: deal value, per-product rows, per-dimension rows and leftovers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationResultArtifacts {

    /**
     * Two-decimal string, null when no product price was found
     */
    private String dealValue;

    @Builder.Default
    private List<DimensionResultEntity> dimensionRows = new ArrayList<>();

    @Builder.Default
    private List<ProductResultEntity> productRows = new ArrayList<>();

    /**
     * Dimension values not consumed by a product match
     */
    @Builder.Default
    private Map<String, Object> otherDimensions = new LinkedHashMap<>();
}
