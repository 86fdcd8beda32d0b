package com.dealsim.api.dto;

import lombok.Data;

/**
 * Manual execution control: "next" runs a single step, "all" starts draining.
 */
@Data
public class ExecuteRequestDTO {

    private String mode;
}
