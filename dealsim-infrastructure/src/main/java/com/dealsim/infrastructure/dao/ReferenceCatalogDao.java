package com.dealsim.infrastructure.dao;

import com.dealsim.infrastructure.dao.po.ProductPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Personality and product catalog DAO
 */
@Mapper
public interface ReferenceCatalogDao {

    List<String> selectPersonalityIds();

    List<ProductPO> selectProductsByNegotiationId(@Param("negotiationId") Long negotiationId);
}
