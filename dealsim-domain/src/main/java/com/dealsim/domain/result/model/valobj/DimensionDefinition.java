package com.dealsim.domain.result.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scenario dimension with its target corridor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DimensionDefinition {

    private String name;

    private Object targetValue;

    private Object minValue;

    private Object maxValue;

    /**
     * 1 (highest) to 5, defaults to 3
     */
    private Integer priority;
}
