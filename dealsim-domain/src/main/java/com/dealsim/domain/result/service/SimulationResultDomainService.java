package com.dealsim.domain.result.service;

import com.dealsim.domain.result.model.entity.DimensionResultEntity;
import com.dealsim.domain.result.model.entity.ProductResultEntity;
import com.dealsim.domain.result.model.valobj.DimensionDefinition;
import com.dealsim.domain.result.model.valobj.ProductDefinition;
import com.dealsim.domain.result.model.valobj.ResultProcessingInput;
import com.dealsim.domain.result.model.valobj.SimulationResultArtifacts;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result processor: reconciles the engine's free-form dimension labels with the configured
 * products and dimensions, and derives the deal value.
 *
 * <p>Product prices are located by a cascade: exact normalized name or product key, then a key
 * containing the name and a price keyword, then a fuzzy prefix / containment match. A product
 * without a match produces no row and contributes nothing to the deal value.</p>
 */
@Slf4j
@Service
public class SimulationResultDomainService {

    private static final String[] PRICE_KEYWORDS = {"preis", "price", "prize"};
    private static final String[] TOTAL_KEYWORDS = {"gesamt", "total", "summe"};
    private static final int DEFAULT_PRIORITY = 3;
    private static final String ROLE_BUYER = "buyer";
    private static final String ROLE_SELLER = "seller";

    public SimulationResultArtifacts buildArtifacts(ResultProcessingInput input) {
        List<Entry> entries = normalizeEntries(input.getDimensionValues(), input.getConversationLog());
        String role = StringUtils.lowerCase(StringUtils.trimToEmpty(input.getUserRole()));
        List<ProductDefinition> products = input.getProducts() == null
                ? Collections.emptyList() : input.getProducts();

        List<DimensionResultEntity> dimensionRows = buildDimensionRows(input.getRunId(), input.getDimensions(), entries);

        Set<String> matchedKeys = new HashSet<>();
        List<ProductResultEntity> productRows = new ArrayList<>();
        double total = 0D;
        for (ProductDefinition product : products) {
            Entry priceEntry = findPriceEntry(product, entries);
            if (priceEntry == null || priceEntry.numeric == null) {
                continue;
            }
            matchedKeys.add(priceEntry.key);
            ProductResultEntity row = buildProductRow(input.getRunId(), product, priceEntry, role);
            total += row.getSubtotal().doubleValue();
            productRows.add(row);
        }

        Map<String, Object> otherDimensions = new LinkedHashMap<>();
        for (Entry entry : entries) {
            if (matchedKeys.contains(entry.key) || entry.raw == null) {
                continue;
            }
            otherDimensions.put(entry.key, entry.numeric != null ? entry.numeric : entry.raw);
        }

        String dealValue = total > 0 ? scale(total, 2).toPlainString() : null;
        if (dealValue == null && !products.isEmpty()) {
            log.warn("No product price matched. runId={}, expectedProducts={}, dimensionKeys={}",
                    input.getRunId(),
                    products.stream().map(ProductDefinition::getName).collect(Collectors.joining(", ")),
                    entries.stream().map(e -> e.key).collect(Collectors.joining(", ")));
        } else if (dealValue != null) {
            log.debug("Deal value calculated. runId={}, dealValue={}, products={}",
                    input.getRunId(), dealValue, productRows.size());
        }

        return SimulationResultArtifacts.builder()
                .dealValue(dealValue)
                .dimensionRows(dimensionRows)
                .productRows(productRows)
                .otherDimensions(otherDimensions)
                .build();
    }

    private List<DimensionResultEntity> buildDimensionRows(Long runId,
                                                           List<DimensionDefinition> dimensions,
                                                           List<Entry> entries) {
        List<DimensionResultEntity> rows = new ArrayList<>();
        if (dimensions == null) {
            return rows;
        }
        for (DimensionDefinition dimension : dimensions) {
            Entry match = findEntryForDimension(dimension.getName(), entries);
            Object fallback = firstNonNull(dimension.getTargetValue(), dimension.getMinValue(), dimension.getMaxValue(), 0);
            Object finalRaw = match == null ? fallback : (match.numeric != null ? match.numeric : match.raw);
            Double finalValue = DimensionKeys.coerceNumber(finalRaw);
            Double targetValue = DimensionKeys.coerceNumber(
                    dimension.getTargetValue() != null ? dimension.getTargetValue() : fallback);
            Double min = DimensionKeys.coerceNumber(dimension.getMinValue());
            Double max = DimensionKeys.coerceNumber(dimension.getMaxValue());
            rows.add(DimensionResultEntity.builder()
                    .runId(runId)
                    .dimensionName(dimension.getName())
                    .finalValue(scale(finalValue, 4))
                    .targetValue(scale(targetValue, 4))
                    .achievedTarget(isWithinRange(finalValue, min, max))
                    .priorityScore(dimension.getPriority() == null ? DEFAULT_PRIORITY : dimension.getPriority())
                    .build());
        }
        return rows;
    }

    private ProductResultEntity buildProductRow(Long runId, ProductDefinition product, Entry priceEntry, String role) {
        double agreed = priceEntry.numeric;
        Double target = product.getTargetPrice();
        Double min = product.getMinPrice();
        Double max = product.getMaxPrice();
        long volume = Math.max(1L, product.getEstimatedVolume() == null ? 1L : product.getEstimatedVolume());

        // buyers drop the lower bound, sellers the upper one; any other role keeps both
        Double roleMin = ROLE_BUYER.equals(role) ? null : min;
        Double roleMax = ROLE_SELLER.equals(role) ? null : max;

        double subtotal = agreed * volume;
        Double priceVsTarget = target != null && target != 0 ? (agreed - target) / target * 100 : null;
        boolean withinZopa = isWithinRange(agreed, roleMin, roleMax);
        Double utilization = zopaUtilization(agreed, roleMin, roleMax);
        double targetSubtotal = (target != null ? target : agreed) * volume;

        return ProductResultEntity.builder()
                .runId(runId)
                .productId(product.getId())
                .productName(product.getName())
                .targetPrice(scale(target != null ? target : agreed, 2))
                .minMaxPrice(scale(max != null ? max : (min != null ? min : agreed), 2))
                .estimatedVolume(volume)
                .agreedPrice(scale(agreed, 2))
                .priceVsTarget(priceVsTarget == null ? null : scale(priceVsTarget, 2))
                .absoluteDeltaFromTarget(scale(target != null ? agreed - target : 0D, 4))
                .priceVsMinMax(utilization == null ? null : scale(utilization * 100, 2))
                .absoluteDeltaFromMinMax(scale(deltaFromBounds(agreed, roleMin, roleMax), 4))
                .withinZopa(withinZopa)
                .zopaUtilization(utilization == null ? null : scale(utilization, 2))
                .subtotal(scale(subtotal, 2))
                .targetSubtotal(scale(targetSubtotal, 2))
                .deltaFromTargetSubtotal(scale(subtotal - targetSubtotal, 2))
                .performanceScore(scale(performanceScore(agreed, target, withinZopa), 2))
                .dimensionKey(priceEntry.key)
                .build();
    }

    private Entry findPriceEntry(ProductDefinition product, List<Entry> entries) {
        String name = DimensionKeys.normalizeKey(product.getName());
        String productKey = DimensionKeys.normalizeKey(product.getProductKey());

        for (Entry entry : entries) {
            if ((!name.isEmpty() && entry.normalized.equals(name))
                    || (!productKey.isEmpty() && entry.normalized.equals(productKey))) {
                return entry;
            }
        }
        for (Entry entry : entries) {
            boolean nameMatch = name.isEmpty() || entry.normalized.contains(name);
            if (nameMatch && DimensionKeys.containsAny(entry.normalized, PRICE_KEYWORDS)) {
                return entry;
            }
        }
        if (name.isEmpty() && productKey.isEmpty()) {
            return null;
        }
        for (Entry entry : entries) {
            String key = entry.normalized;
            if (DimensionKeys.containsAny(key, TOTAL_KEYWORDS)) {
                continue;
            }
            if (name.length() > 5 && key.startsWith(name.substring(0, 6))) {
                return entry;
            }
            if (productKey.length() > 5 && key.startsWith(productKey.substring(0, 6))) {
                return entry;
            }
            if (name.length() > 4 && key.length() > 4 && (name.contains(key) || key.contains(name))) {
                return entry;
            }
        }
        return null;
    }

    private Entry findEntryForDimension(String dimensionName, List<Entry> entries) {
        String name = DimensionKeys.normalizeKey(dimensionName);
        for (Entry entry : entries) {
            if (entry.normalized.equals(name)) {
                return entry;
            }
        }
        for (Entry entry : entries) {
            if (entry.normalized.contains(name)) {
                return entry;
            }
        }
        for (Entry entry : entries) {
            if (name.contains(entry.normalized)) {
                return entry;
            }
        }
        return null;
    }

    /**
     * Final offer values first, then offers from the conversation log newest first. Earlier
     * sources win on equal normalized keys.
     */
    @SuppressWarnings("unchecked")
    private List<Entry> normalizeEntries(Map<String, Object> values, List<Map<String, Object>> conversationLog) {
        Map<String, Entry> byNormalized = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((key, raw) -> {
                String normalized = DimensionKeys.normalizeKey(key);
                byNormalized.put(normalized, new Entry(key, normalized, raw));
            });
        }
        if (conversationLog != null) {
            for (int i = conversationLog.size() - 1; i >= 0; i--) {
                Map<String, Object> item = conversationLog.get(i);
                if (item == null || !(item.get("offer") instanceof Map)) {
                    continue;
                }
                Map<String, Object> offer = (Map<String, Object>) item.get("offer");
                Object dimensionValues = offer.get("dimension_values") != null
                        ? offer.get("dimension_values") : offer.get("dimensionValues");
                if (!(dimensionValues instanceof Map)) {
                    continue;
                }
                ((Map<String, Object>) dimensionValues).forEach((key, raw) -> {
                    String normalized = DimensionKeys.normalizeKey(key);
                    byNormalized.putIfAbsent(normalized, new Entry(key, normalized, raw));
                });
            }
        }
        return new ArrayList<>(byNormalized.values());
    }

    private boolean isWithinRange(Double value, Double min, Double max) {
        if (value == null) {
            return false;
        }
        if (min == null && max == null) {
            return true;
        }
        double a = min != null ? min : value;
        double b = max != null ? max : value;
        return value >= Math.min(a, b) && value <= Math.max(a, b);
    }

    private Double zopaUtilization(double value, Double min, Double max) {
        if (min == null || max == null || max.equals(min)) {
            return null;
        }
        return (value - min) / (max - min);
    }

    private double deltaFromBounds(double value, Double min, Double max) {
        if (min != null && value < min) {
            return value - min;
        }
        if (max != null && value > max) {
            return value - max;
        }
        return 0D;
    }

    private double performanceScore(double value, Double target, boolean withinZopa) {
        if (target != null && target > 0) {
            double deltaPct = Math.abs((value - target) / target);
            double base = Math.max(0D, 100D - deltaPct * 100D);
            return withinZopa ? base : Math.max(0D, base - 10D);
        }
        return withinZopa ? 80D : 60D;
    }

    private static BigDecimal scale(Double value, int places) {
        double safe = value == null || value.isNaN() ? 0D : value;
        return BigDecimal.valueOf(safe).setScale(places, RoundingMode.HALF_UP);
    }

    private static Object firstNonNull(Object... values) {
        for (Object value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static final class Entry {
        private final String key;
        private final String normalized;
        private final Object raw;
        private final Double numeric;

        private Entry(String key, String normalized, Object raw) {
            this.key = key;
            this.normalized = normalized;
            this.raw = raw;
            this.numeric = DimensionKeys.coerceNumber(raw);
        }
    }
}
