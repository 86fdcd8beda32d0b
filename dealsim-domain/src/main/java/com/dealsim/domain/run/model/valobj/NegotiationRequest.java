package com.dealsim.domain.run.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parameters handed to the negotiation engine for one run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NegotiationRequest {

    private Long negotiationId;

    private Long runId;

    private Long queueId;

    private Long techniqueId;

    private Long tacticId;

    private String personalityId;

    private String zopaDistance;

    private Integer maxRounds;
}
