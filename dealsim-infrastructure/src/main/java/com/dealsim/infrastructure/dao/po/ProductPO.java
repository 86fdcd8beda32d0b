package com.dealsim.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * products row
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductPO {

    private Long id;

    private Long negotiationId;

    private String name;

    /**
     * JSONB: product_key, targetPrice, minPrice, maxPrice, estimatedVolume
     */
    private String attrs;
}
