package com.dealsim.domain.queue.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Queue creation request. Personality and distance selectors may contain the "all" sentinel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueCreateCommand {

    private Long negotiationId;

    private List<Long> techniqueIds;

    private List<Long> tacticIds;

    private List<String> personalitySelector;

    private List<String> distanceSelector;
}
