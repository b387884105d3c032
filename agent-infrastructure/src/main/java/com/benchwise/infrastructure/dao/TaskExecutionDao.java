package com.benchwise.infrastructure.dao;

import com.benchwise.infrastructure.dao.po.TaskExecutionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Task execution DAO
 *
 * @author benchwise
 * @since 2026-03-07
 */
@Mapper
public interface TaskExecutionDao {

    /**
     * Insert an execution entry
     */
    int insert(TaskExecutionPO po);

    /**
     * Close an open execution entry
     */
    int close(TaskExecutionPO po);

    /**
     * Raise progress of an open entry, keeping the larger value
     */
    int updateProgress(@Param("id") Long id,
                       @Param("progress") Integer progress,
                       @Param("currentStep") String currentStep);

    /**
     * Select by ID
     */
    TaskExecutionPO selectById(@Param("id") Long id);

    /**
     * Select by task ID ordered by start time
     */
    List<TaskExecutionPO> selectByTaskId(@Param("taskId") Long taskId);

    /**
     * Select open entries of a task
     */
    List<TaskExecutionPO> selectOpenByTaskId(@Param("taskId") Long taskId);
}
