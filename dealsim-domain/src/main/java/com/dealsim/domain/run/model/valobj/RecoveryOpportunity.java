package com.dealsim.domain.run.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Crash recovery snapshot for one negotiation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryOpportunity {

    private boolean hasRecoverableSession;

    /**
     * Latest queue of the negotiation
     */
    private Long queueId;

    /**
     * Checkpoint of the most recently started orphan
     */
    private Map<String, Object> checkpoint;

    @Builder.Default
    private List<Long> orphanedSimulations = new ArrayList<>();
}
