package com.dealsim.api.dto;

import lombok.Data;

import java.util.List;

/**
 * Orphaned run ids to hand back to the scheduler.
 */
@Data
public class RecoverRequestDTO {

    private List<Long> runIds;
}
