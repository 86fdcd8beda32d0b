package com.dealsim.domain.result.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Agreed price and derived metrics of one product in a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductResultEntity {

    private Long id;

    private Long runId;

    private Long productId;

    private String productName;

    private BigDecimal targetPrice;

    private BigDecimal minMaxPrice;

    private Long estimatedVolume;

    private BigDecimal agreedPrice;

    /**
     * Percent, null without a target price
     */
    private BigDecimal priceVsTarget;

    private BigDecimal absoluteDeltaFromTarget;

    private BigDecimal priceVsMinMax;

    private BigDecimal absoluteDeltaFromMinMax;

    private Boolean withinZopa;

    private BigDecimal zopaUtilization;

    private BigDecimal subtotal;

    private BigDecimal targetSubtotal;

    private BigDecimal deltaFromTargetSubtotal;

    private BigDecimal performanceScore;

    /**
     * Dimension label the price was read from
     */
    private String dimensionKey;
}
