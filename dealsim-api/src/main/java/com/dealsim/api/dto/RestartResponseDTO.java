package com.dealsim.api.dto;

import lombok.Data;

/**
 * Number of runs affected by a restart, retry or recovery command.
 */
@Data
public class RestartResponseDTO {

    private Long queueId;
    private Integer affectedCount;
}
