package com.dealsim.api.dto;

import lombok.Data;

import java.util.List;

/**
 * Queue creation request. Personality and distance selectors accept "all".
 */
@Data
public class QueueCreateRequestDTO {

    private Long negotiationId;
    private List<Long> techniqueIds;
    private List<Long> tacticIds;
    private List<String> personalities;
    private List<String> distances;
}
