package com.dealsim.domain.result.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Product negotiated in a scenario, with its price corridor and fixed volume.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductDefinition {

    private Long id;

    private String name;

    /**
     * Engine-facing key, often more reliable than the display name
     */
    private String productKey;

    private Double targetPrice;

    private Double minPrice;

    private Double maxPrice;

    private Long estimatedVolume;
}
