package com.dealsim.domain.queue.model.valobj;

import com.dealsim.types.enums.RunStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Run counts and cost of one queue, aggregated from the run rows.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueRunStats {

    private Long queueId;

    @Builder.Default
    private Map<RunStatusEnum, Integer> countsByStatus = new EnumMap<>(RunStatusEnum.class);

    @Builder.Default
    private BigDecimal totalCost = BigDecimal.ZERO;

    public int count(RunStatusEnum status) {
        Integer value = countsByStatus == null ? null : countsByStatus.get(status);
        return value == null ? 0 : value;
    }

    public int getCompletedCount() {
        return count(RunStatusEnum.COMPLETED);
    }

    /**
     * Failed and timed out runs.
     */
    public int getFailedCount() {
        return count(RunStatusEnum.FAILED) + count(RunStatusEnum.TIMEOUT);
    }

    public int getPendingCount() {
        return count(RunStatusEnum.PENDING);
    }

    public int getRunningCount() {
        return count(RunStatusEnum.RUNNING);
    }

    public int getTotalCount() {
        int total = 0;
        if (countsByStatus != null) {
            for (Integer value : countsByStatus.values()) {
                total += value == null ? 0 : value;
            }
        }
        return total;
    }
}
