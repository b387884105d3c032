package com.benchwise.infrastructure.dao;

import com.benchwise.infrastructure.dao.po.DocumentPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Document DAO
 *
 * @author benchwise
 * @since 2026-03-07
 */
@Mapper
public interface DocumentDao {

    /**
     * Select by ID list
     */
    List<DocumentPO> selectByIds(@Param("ids") List<Long> ids);

    /**
     * Select by matter ID
     */
    List<DocumentPO> selectByMatterId(@Param("matterId") Long matterId);
}
