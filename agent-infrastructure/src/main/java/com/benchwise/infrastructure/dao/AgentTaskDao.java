package com.benchwise.infrastructure.dao;

import com.benchwise.infrastructure.dao.po.AgentTaskPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Agent task DAO
 *
 * @author benchwise
 * @since 2026-03-07
 */
@Mapper
public interface AgentTaskDao {

    /**
     * Insert a task
     */
    int insert(AgentTaskPO po);

    /**
     * Compare-and-set status write. Matches only while the row has {@code expectedStatus}.
     */
    int updateStatus(@Param("po") AgentTaskPO po, @Param("expectedStatus") String expectedStatus);

    /**
     * Raise progress of a running task, keeping the larger value
     */
    int updateProgress(@Param("id") Long id,
                       @Param("progress") Integer progress,
                       @Param("currentStep") String currentStep);

    /**
     * Refresh the heartbeat of a running task
     */
    int touchHeartbeat(@Param("id") Long id);

    /**
     * Select by ID
     */
    AgentTaskPO selectById(@Param("id") Long id);

    /**
     * Select by matter ID, newest first
     */
    List<AgentTaskPO> selectByMatterId(@Param("matterId") Long matterId);

    /**
     * Select by status, oldest first
     */
    List<AgentTaskPO> selectByStatus(@Param("status") String status);

    /**
     * Select the most recent tasks
     */
    List<AgentTaskPO> selectRecent(@Param("limit") Integer limit);

    /**
     * Select running tasks whose heartbeat is older than the given time
     */
    List<AgentTaskPO> selectStaleRunning(@Param("heartbeatBefore") LocalDateTime heartbeatBefore,
                                         @Param("limit") Integer limit);
}
