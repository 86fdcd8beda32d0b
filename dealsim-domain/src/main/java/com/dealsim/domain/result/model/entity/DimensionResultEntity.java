package com.dealsim.domain.result.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Final value of one scenario dimension in a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DimensionResultEntity {

    private Long id;

    private Long runId;

    private String dimensionName;

    private BigDecimal finalValue;

    private BigDecimal targetValue;

    private Boolean achievedTarget;

    private Integer priorityScore;
}
