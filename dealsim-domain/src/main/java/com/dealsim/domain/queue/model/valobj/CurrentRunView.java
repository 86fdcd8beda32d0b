package com.dealsim.domain.queue.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * The run currently dispatched for a queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrentRunView {

    private Long runId;

    private Integer runNumber;

    private Long techniqueId;

    private Long tacticId;

    private LocalDateTime startedAt;
}
