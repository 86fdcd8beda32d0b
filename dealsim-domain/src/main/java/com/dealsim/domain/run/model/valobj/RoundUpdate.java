package com.dealsim.domain.run.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Per-round progress emitted by the engine while a run executes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoundUpdate {

    private Integer round;

    private String agent;

    private String message;

    private Map<String, Object> offer;
}
