package com.dealsim.infrastructure.dao;

import com.dealsim.infrastructure.dao.po.ProductResultPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Product result DAO
 */
@Mapper
public interface ProductResultDao {

    int deleteByRunId(@Param("runId") Long runId);

    int batchInsert(@Param("list") List<ProductResultPO> list);

    List<ProductResultPO> selectByRunId(@Param("runId") Long runId);
}
