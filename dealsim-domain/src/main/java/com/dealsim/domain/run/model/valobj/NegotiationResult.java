package com.dealsim.domain.run.model.valobj;

import com.dealsim.types.enums.NegotiationOutcomeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Result of one engine call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NegotiationResult {

    /**
     * Classified outcome
     */
    private NegotiationOutcomeEnum outcome;

    /**
     * Label as reported by the engine
     */
    private String rawOutcome;

    private String outcomeReason;

    private Integer totalRounds;

    private List<Map<String, Object>> conversationLog;

    /**
     * Dimension values of the final offer, keyed by the engine's labels
     */
    private Map<String, Object> finalDimensionValues;

    public int roundsOrZero() {
        return totalRounds == null ? 0 : Math.max(0, totalRounds);
    }
}
