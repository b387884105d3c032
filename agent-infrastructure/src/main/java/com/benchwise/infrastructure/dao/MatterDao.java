package com.benchwise.infrastructure.dao;

import com.benchwise.infrastructure.dao.po.MatterPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * Matter DAO
 *
 * @author benchwise
 * @since 2026-03-07
 */
@Mapper
public interface MatterDao {

    /**
     * Select by ID
     */
    MatterPO selectById(@Param("id") Long id);
}
