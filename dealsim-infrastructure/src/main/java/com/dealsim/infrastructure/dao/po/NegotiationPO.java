package com.dealsim.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * negotiations row
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NegotiationPO {

    private Long id;

    private String title;

    private String status;

    /**
     * JSONB: userRole, dimensions[]
     */
    private String scenario;

    private LocalDateTime startedAt;

    private LocalDateTime endedAt;
}
