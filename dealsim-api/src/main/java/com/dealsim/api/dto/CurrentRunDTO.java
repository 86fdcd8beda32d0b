package com.dealsim.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * Run currently dispatched for a queue.
 */
@Data
public class CurrentRunDTO {

    private Long runId;
    private Integer runNumber;
    private Long techniqueId;
    private Long tacticId;
    private LocalDateTime startedAt;
}
