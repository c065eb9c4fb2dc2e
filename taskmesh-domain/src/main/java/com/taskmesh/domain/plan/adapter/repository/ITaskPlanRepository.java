package com.taskmesh.domain.plan.adapter.repository;

import com.taskmesh.domain.plan.model.entity.TaskPlanEntity;
import com.taskmesh.domain.task.model.valobj.TaskRetryPolicy;

import java.util.List;

/**
 * 计划仓储接口：一个会话一条记录，写入依赖版本号做 compare-and-swap。
 *
 * @author taskmesh
 * @since 2026-09-02
 */
public interface ITaskPlanRepository {

    /**
     * 按会话查询计划，不存在返回 null
     */
    TaskPlanEntity findBySessionId(String sessionId);

    /**
     * 插入新计划，会话已有计划时返回 false
     */
    boolean insert(TaskPlanEntity plan);

    /**
     * 仅当存储版本与 plan.version 相同时写入，成功后 plan.version 加一
     */
    boolean updateWithVersion(TaskPlanEntity plan);

    /**
     * 删除计划，不存在时返回 false
     */
    boolean deleteBySessionId(String sessionId);

    /**
     * 仍有 pending/ready/running 任务，或有尚存重试预算的 failed 任务的会话，按更新时间升序。
     * 重试预算耗尽的失败任务不算未结束，否则这类计划会一直占满轮询批次。
     */
    List<String> findUnsettledSessionIds(int limit, TaskRetryPolicy retryPolicy);
}
