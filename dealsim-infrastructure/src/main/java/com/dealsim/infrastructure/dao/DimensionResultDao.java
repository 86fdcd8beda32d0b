package com.dealsim.infrastructure.dao;

import com.dealsim.infrastructure.dao.po.DimensionResultPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Dimension result DAO
 */
@Mapper
public interface DimensionResultDao {

    int deleteByRunId(@Param("runId") Long runId);

    int batchInsert(@Param("list") List<DimensionResultPO> list);

    List<DimensionResultPO> selectByRunId(@Param("runId") Long runId);
}
