package com.dealsim.infrastructure.dao;

import com.dealsim.infrastructure.dao.po.SimulationQueuePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Simulation queue DAO
 *
 * @author dealsim
 * @since 2026-03-02
 */
@Mapper
public interface SimulationQueueDao {

    int insert(SimulationQueuePO po);

    SimulationQueuePO selectById(@Param("id") Long id);

    /**
     * Locks the queue row for the rest of the transaction.
     */
    Long lockById(@Param("id") Long id);

    List<SimulationQueuePO> selectByNegotiationId(@Param("negotiationId") Long negotiationId);

    SimulationQueuePO selectLatestActiveByNegotiationId(@Param("negotiationId") Long negotiationId);

    List<SimulationQueuePO> selectByStatuses(@Param("statuses") List<String> statuses);

    /**
     * Status, timestamps and last error, guarded by the status the caller read.
     */
    int updateStatus(@Param("po") SimulationQueuePO po, @Param("expectedStatus") String expectedStatus);

    int updateRollup(@Param("id") Long id,
                     @Param("completedCount") Integer completedCount,
                     @Param("failedCount") Integer failedCount,
                     @Param("actualTotalCost") BigDecimal actualTotalCost,
                     @Param("updatedAt") LocalDateTime updatedAt);
}
