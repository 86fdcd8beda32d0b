package com.dealsim.api.dto;

import lombok.Data;

/**
 * Manual execution result.
 */
@Data
public class ExecuteResponseDTO {

    private Long queueId;
    private String mode;
    /** whether more runs may be dispatched */
    private Boolean hasMore;
    private String queueStatus;
}
