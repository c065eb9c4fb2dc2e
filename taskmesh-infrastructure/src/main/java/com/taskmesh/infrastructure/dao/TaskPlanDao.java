package com.taskmesh.infrastructure.dao;

import com.taskmesh.infrastructure.dao.po.TaskPlanPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 计划 DAO
 *
 * @author taskmesh
 * @since 2026-09-02
 */
@Mapper
public interface TaskPlanDao {

    /**
     * 插入计划，会话已存在时不插入 (ON CONFLICT DO NOTHING)
     */
    int insertIfAbsent(TaskPlanPO po);

    /**
     * 按会话更新 (带乐观锁)
     */
    int updateWithVersion(TaskPlanPO po);

    /**
     * 按会话删除
     */
    int deleteBySessionId(@Param("sessionId") String sessionId);

    /**
     * 按会话查询
     */
    TaskPlanPO selectBySessionId(@Param("sessionId") String sessionId);

    /**
     * 查询仍有未结束任务的会话；failed 任务仅在 attempt_count &lt; maxAttempts 时计入
     */
    List<String> selectUnsettledSessionIds(@Param("limit") Integer limit, @Param("maxAttempts") Integer maxAttempts);
}
