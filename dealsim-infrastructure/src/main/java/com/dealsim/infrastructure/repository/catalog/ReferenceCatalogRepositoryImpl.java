package com.dealsim.infrastructure.repository.catalog;

import com.dealsim.domain.catalog.adapter.repository.IReferenceCatalogRepository;
import com.dealsim.domain.result.model.valobj.ProductDefinition;
import com.dealsim.domain.result.service.DimensionKeys;
import com.dealsim.infrastructure.dao.ReferenceCatalogDao;
import com.dealsim.infrastructure.dao.po.ProductPO;
import com.dealsim.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Personality and product catalogs.
 */
@Repository
public class ReferenceCatalogRepositoryImpl implements IReferenceCatalogRepository {

    private final ReferenceCatalogDao referenceCatalogDao;
    private final JsonCodec jsonCodec;

    public ReferenceCatalogRepositoryImpl(ReferenceCatalogDao referenceCatalogDao, JsonCodec jsonCodec) {
        this.referenceCatalogDao = referenceCatalogDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public List<String> findAllPersonalityIds() {
        return referenceCatalogDao.selectPersonalityIds();
    }

    @Override
    public List<ProductDefinition> findProductsByNegotiationId(Long negotiationId) {
        return referenceCatalogDao.selectProductsByNegotiationId(negotiationId).stream()
                .map(this::toDefinition)
                .collect(Collectors.toList());
    }

    private ProductDefinition toDefinition(ProductPO po) {
        Map<String, Object> attrs = jsonCodec.readMap(po.getAttrs());
        if (attrs == null) {
            attrs = Collections.emptyMap();
        }
        Double volume = DimensionKeys.coerceNumber(first(attrs, "estimatedVolume", "volume"));
        Object productKey = attrs.get("product_key");
        return ProductDefinition.builder()
                .id(po.getId())
                .name(po.getName())
                .productKey(productKey == null ? null : String.valueOf(productKey))
                .targetPrice(DimensionKeys.coerceNumber(attrs.get("targetPrice")))
                .minPrice(DimensionKeys.coerceNumber(first(attrs, "minPrice", "min")))
                .maxPrice(DimensionKeys.coerceNumber(first(attrs, "maxPrice", "max")))
                .estimatedVolume(volume == null ? null : Math.round(volume))
                .build();
    }

    private Object first(Map<String, Object> attrs, String key, String alternative) {
        Object value = attrs.get(key);
        return value != null ? value : attrs.get(alternative);
    }
}
