package com.dealsim.api.dto;

import lombok.Data;

import java.util.List;

/**
 * Selective retry; an empty or missing list retries every failed or timed out run.
 */
@Data
public class RetryRunsRequestDTO {

    private List<Long> runIds;
}
