package com.dealsim.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * dimension_results row
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DimensionResultPO {

    private Long id;

    private Long runId;

    private String dimensionName;

    private BigDecimal finalValue;

    private BigDecimal targetValue;

    private Boolean achievedTarget;

    private Integer priorityScore;
}
