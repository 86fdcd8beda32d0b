package com.dealsim.domain.negotiation.model.entity;

import com.dealsim.domain.result.model.valobj.DimensionDefinition;
import com.dealsim.types.enums.NegotiationStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Negotiation owning simulation queues. Only the scenario parts needed for result processing are mapped.
 */
@Data
public class NegotiationEntity {

    private Long id;

    private String title;

    private NegotiationStatusEnum status;

    /**
     * "buyer" or "seller"
     */
    private String userRole;

    private List<DimensionDefinition> dimensions = new ArrayList<>();

    private LocalDateTime startedAt;

    private LocalDateTime endedAt;
}
