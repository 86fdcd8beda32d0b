package com.dealsim.api.dto;

import lombok.Data;

/**
 * Queue creation response.
 */
@Data
public class QueueCreateResponseDTO {

    private Long queueId;
    private Long negotiationId;
    private Integer totalSimulations;
    private String status;
}
