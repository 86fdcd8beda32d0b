package com.dealsim.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * product_results row
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductResultPO {

    private Long id;

    private Long runId;

    private Long productId;

    private String productName;

    private BigDecimal targetPrice;

    private BigDecimal minMaxPrice;

    private Long estimatedVolume;

    private BigDecimal agreedPrice;

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

    private String dimensionKey;
}
