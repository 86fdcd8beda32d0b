package com.dealsim.domain.catalog.adapter.repository;

import com.dealsim.domain.result.model.valobj.ProductDefinition;

import java.util.List;

/**
 * Read-only catalogs consulted when a queue is built and when results are processed.
 */
public interface IReferenceCatalogRepository {

    /**
     * Every known counterpart personality id, in catalog order.
     */
    List<String> findAllPersonalityIds();

    List<ProductDefinition> findProductsByNegotiationId(Long negotiationId);
}
