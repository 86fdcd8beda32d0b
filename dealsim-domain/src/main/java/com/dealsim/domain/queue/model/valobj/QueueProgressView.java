package com.dealsim.domain.queue.model.valobj;

import com.dealsim.types.enums.QueueStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Point-in-time progress of a queue, derived from run rows.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueProgressView {

    private Long queueId;

    private Long negotiationId;

    private QueueStatusEnum status;

    private int totalSimulations;

    private int completedCount;

    /**
     * Failed plus timed out
     */
    private int failedCount;

    private int pendingCount;

    private int runningCount;

    private int pausedCount;

    private int abortedCount;

    private int progressPercentage;

    /**
     * Seconds
     */
    private long estimatedTimeRemaining;

    private CurrentRunView currentSimulation;

    private BigDecimal actualCost;

    private BigDecimal estimatedCost;
}
