package com.dealsim.domain.result.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Everything the result processor needs for one run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResultProcessingInput {

    private Long runId;

    /**
     * "buyer" or "seller"; anything else is treated as seller
     */
    private String userRole;

    private Map<String, Object> dimensionValues;

    private List<Map<String, Object>> conversationLog;

    private List<ProductDefinition> products;

    private List<DimensionDefinition> dimensions;
}
