package com.dealsim.infrastructure.dao;

import com.dealsim.infrastructure.dao.po.RunStatusStatPO;
import com.dealsim.infrastructure.dao.po.SimulationRunPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Simulation run DAO
 *
 * @author dealsim
 * @since 2026-03-02
 */
@Mapper
public interface SimulationRunDao {

    int batchInsert(@Param("list") List<SimulationRunPO> list);

    SimulationRunPO selectById(@Param("id") Long id);

    String selectStatusById(@Param("id") Long id);

    List<SimulationRunPO> selectByQueueId(@Param("queueId") Long queueId);

    List<SimulationRunPO> selectByQueueIdAndStatuses(@Param("queueId") Long queueId,
                                                     @Param("statuses") List<String> statuses);

    List<SimulationRunPO> selectByNegotiationId(@Param("negotiationId") Long negotiationId);

    int countByQueueIdAndStatus(@Param("queueId") Long queueId, @Param("status") String status);

    /**
     * Next pending run by execution order, row locked, skipping rows locked by others.
     */
    SimulationRunPO selectNextPendingForUpdate(@Param("queueId") Long queueId);

    /**
     * Full state write guarded by the expected stored status.
     */
    int updateStateIfStatus(@Param("po") SimulationRunPO po, @Param("expectedStatus") String expectedStatus);

    int updateArtifacts(SimulationRunPO po);

    List<SimulationRunPO> markStaleRunningAsTimeout(@Param("threshold") LocalDateTime threshold,
                                                    @Param("now") LocalDateTime now);

    List<SimulationRunPO> selectStaleRunning(@Param("negotiationId") Long negotiationId,
                                             @Param("threshold") LocalDateTime threshold);

    List<SimulationRunPO> abortActive(@Param("queueId") Long queueId, @Param("now") LocalDateTime now);

    List<RunStatusStatPO> summarizeByQueueId(@Param("queueId") Long queueId);
}
