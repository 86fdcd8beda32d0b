package com.dealsim.test.domain;

import com.dealsim.domain.result.model.entity.DimensionResultEntity;
import com.dealsim.domain.result.model.entity.ProductResultEntity;
import com.dealsim.domain.result.model.valobj.DimensionDefinition;
import com.dealsim.domain.result.model.valobj.ProductDefinition;
import com.dealsim.domain.result.model.valobj.ResultProcessingInput;
import com.dealsim.domain.result.model.valobj.SimulationResultArtifacts;
import com.dealsim.domain.result.service.DimensionKeys;
import com.dealsim.domain.result.service.SimulationResultDomainService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SimulationResultDomainServiceTest {

    private final SimulationResultDomainService service = new SimulationResultDomainService();

    @Test
    public void shouldComputeDealValueFromPriceKeyTimesVolume() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("Preis_WidgetA", 12.5);
        values.put("Lieferzeit", "14 Tage");

        SimulationResultArtifacts artifacts = service.buildArtifacts(input("seller", values,
                Collections.singletonList(widget(11.0, 10.0, 15.0))));

        Assertions.assertEquals("1250.00", artifacts.getDealValue());
        Assertions.assertEquals(1, artifacts.getProductRows().size());
        ProductResultEntity row = artifacts.getProductRows().get(0);
        Assertions.assertEquals("Preis_WidgetA", row.getDimensionKey());
        Assertions.assertEquals(0, new BigDecimal("12.50").compareTo(row.getAgreedPrice()));
        Assertions.assertEquals(100L, row.getEstimatedVolume());
        Assertions.assertTrue(row.getWithinZopa());
        Assertions.assertFalse(artifacts.getOtherDimensions().containsKey("Preis_WidgetA"));
        Assertions.assertEquals(14D, artifacts.getOtherDimensions().get("Lieferzeit"));
    }

    @Test
    public void shouldLeaveDealValueNullWhenNoProductMatches() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("Zahlungsziel", 30);

        SimulationResultArtifacts artifacts = service.buildArtifacts(input("buyer", values,
                Collections.singletonList(widget(11.0, 10.0, 15.0))));

        Assertions.assertNull(artifacts.getDealValue());
        Assertions.assertTrue(artifacts.getProductRows().isEmpty());
        Assertions.assertEquals(30D, artifacts.getOtherDimensions().get("Zahlungsziel"));
    }

    @Test
    public void shouldReadPriceFromConversationLogWhenFinalValuesAreEmpty() {
        Map<String, Object> dimensionValues = new HashMap<>();
        dimensionValues.put("WidgetA Price", "9,75 EUR");
        Map<String, Object> offer = new HashMap<>();
        offer.put("dimension_values", dimensionValues);
        Map<String, Object> message = new HashMap<>();
        message.put("offer", offer);
        List<Map<String, Object>> log = new ArrayList<>();
        log.add(message);

        SimulationResultArtifacts artifacts = service.buildArtifacts(ResultProcessingInput.builder()
                .runId(1L)
                .userRole("buyer")
                .dimensionValues(Collections.emptyMap())
                .conversationLog(log)
                .products(Collections.singletonList(widget(11.0, 10.0, 15.0)))
                .build());

        Assertions.assertEquals("975.00", artifacts.getDealValue());
    }

    @Test
    public void shouldMeasureBuyerOvershootAgainstMaximum() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("widgeta", 16.0);

        SimulationResultArtifacts artifacts = service.buildArtifacts(input("buyer", values,
                Collections.singletonList(widget(11.0, 10.0, 15.0))));

        ProductResultEntity row = artifacts.getProductRows().get(0);
        Assertions.assertEquals(0, new BigDecimal("1.0000").compareTo(row.getAbsoluteDeltaFromMinMax()));
        Assertions.assertEquals(0, new BigDecimal("45.45").compareTo(row.getPriceVsTarget()));
        Assertions.assertNull(row.getZopaUtilization());
    }

    @Test
    public void shouldKeepBothZopaBoundsWhenRoleIsUnknown() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("widgeta", 16.0);
        List<ProductDefinition> products = Collections.singletonList(widget(11.0, 10.0, 15.0));

        ProductResultEntity unknown = service.buildArtifacts(input(null, values, products)).getProductRows().get(0);
        ProductResultEntity seller = service.buildArtifacts(input("seller", values, products)).getProductRows().get(0);

        Assertions.assertFalse(unknown.getWithinZopa());
        Assertions.assertEquals(0, new BigDecimal("1.0000").compareTo(unknown.getAbsoluteDeltaFromMinMax()));
        Assertions.assertTrue(seller.getWithinZopa());
    }

    @Test
    public void shouldBuildDimensionRowsWithTargetCheck() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("Lieferzeit (Tage)", 12);
        DimensionDefinition dimension = DimensionDefinition.builder()
                .name("Lieferzeit")
                .targetValue(10)
                .minValue(7)
                .maxValue(14)
                .build();

        SimulationResultArtifacts artifacts = service.buildArtifacts(ResultProcessingInput.builder()
                .runId(5L)
                .userRole("seller")
                .dimensionValues(values)
                .dimensions(Collections.singletonList(dimension))
                .build());

        Assertions.assertEquals(1, artifacts.getDimensionRows().size());
        DimensionResultEntity row = artifacts.getDimensionRows().get(0);
        Assertions.assertEquals(5L, row.getRunId());
        Assertions.assertEquals(0, new BigDecimal("12").compareTo(row.getFinalValue()));
        Assertions.assertTrue(row.getAchievedTarget());
        Assertions.assertEquals(3, row.getPriorityScore());
    }

    @Test
    public void shouldNormalizeKeysAndCoerceNumbers() {
        Assertions.assertEquals("preiswidgeta", DimensionKeys.normalizeKey("Preis_Widget-A"));
        Assertions.assertEquals("groesse", DimensionKeys.normalizeKey("Größe"));
        Assertions.assertEquals(12.5D, DimensionKeys.coerceNumber("12,5 EUR"));
        Assertions.assertNull(DimensionKeys.coerceNumber("n/a"));
        Assertions.assertNull(DimensionKeys.coerceNumber(Double.NaN));
    }

    private ResultProcessingInput input(String role, Map<String, Object> values, List<ProductDefinition> products) {
        return ResultProcessingInput.builder()
                .runId(1L)
                .userRole(role)
                .dimensionValues(values)
                .conversationLog(Collections.emptyList())
                .products(products)
                .dimensions(Collections.emptyList())
                .build();
    }

    private ProductDefinition widget(Double target, Double min, Double max) {
        return ProductDefinition.builder()
                .id(1L)
                .name("WidgetA")
                .productKey("widget_a")
                .targetPrice(target)
                .minPrice(min)
                .maxPrice(max)
                .estimatedVolume(100L)
                .build();
    }
}
