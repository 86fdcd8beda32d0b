package com.dealsim.test.support;

import com.dealsim.domain.catalog.adapter.repository.IReferenceCatalogRepository;
import com.dealsim.domain.result.model.valobj.ProductDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory personality and product catalogs.
 */
public class InMemoryReferenceCatalogRepository implements IReferenceCatalogRepository {

    private final List<String> personalityIds = new ArrayList<>();
    private final Map<Long, List<ProductDefinition>> productsByNegotiation = new ConcurrentHashMap<>();

    public void addPersonality(String personalityId) {
        personalityIds.add(personalityId);
    }

    public void addProduct(Long negotiationId, ProductDefinition product) {
        productsByNegotiation.computeIfAbsent(negotiationId, key -> new ArrayList<>()).add(product);
    }

    @Override
    public List<String> findAllPersonalityIds() {
        return new ArrayList<>(personalityIds);
    }

    @Override
    public List<ProductDefinition> findProductsByNegotiationId(Long negotiationId) {
        return new ArrayList<>(productsByNegotiation.getOrDefault(negotiationId, new ArrayList<>()));
    }
}
