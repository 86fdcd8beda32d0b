package com.dealsim.domain.negotiation.adapter.repository;

import com.dealsim.domain.negotiation.model.entity.NegotiationEntity;
import com.dealsim.types.enums.NegotiationStatusEnum;

/**
 * Negotiation repository.
 */
public interface INegotiationRepository {

    NegotiationEntity findById(Long id);

    /**
     * Sets the status, stamping started/ended timestamps where they apply.
     */
    boolean updateStatus(Long id, NegotiationStatusEnum status);
}
