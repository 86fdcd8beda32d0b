package com.dealsim.infrastructure.dao;

import com.dealsim.infrastructure.dao.po.NegotiationPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;

/**
 * Negotiation DAO
 */
@Mapper
public interface NegotiationDao {

    NegotiationPO selectById(@Param("id") Long id);

    int updateStatus(@Param("id") Long id,
                     @Param("status") String status,
                     @Param("startedAt") LocalDateTime startedAt,
                     @Param("endedAt") LocalDateTime endedAt);
}
