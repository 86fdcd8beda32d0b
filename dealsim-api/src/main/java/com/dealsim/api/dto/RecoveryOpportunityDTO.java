package com.dealsim.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Crash recovery snapshot for a negotiation.
 */
@Data
public class RecoveryOpportunityDTO {

    private Boolean hasRecoverableSession;
    private Long queueId;
    private Map<String, Object> checkpoint;
    private List<Long> orphanedSimulations;
}
