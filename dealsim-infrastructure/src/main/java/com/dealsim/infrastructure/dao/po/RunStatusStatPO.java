package com.dealsim.infrastructure.dao.po;

import lombok.Data;

import java.math.BigDecimal;

/**
 * Run count and cost per status of one queue.
 */
@Data
public class RunStatusStatPO {

    private String status;

    private Integer total;

    private BigDecimal totalCost;
}
