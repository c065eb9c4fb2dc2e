package com.taskmesh.infrastructure.repository.plan;

import com.taskmesh.domain.plan.adapter.repository.ITaskPlanRepository;
import com.taskmesh.domain.plan.model.entity.TaskPlanEntity;
import com.taskmesh.domain.task.model.valobj.TaskRetryPolicy;
import com.taskmesh.infrastructure.dao.TaskPlanDao;
import com.taskmesh.infrastructure.dao.po.TaskPlanPO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;

/**
 * 计划仓储实现类（PostgreSQL）。
 * <p>
 * 一行一个会话，tasks 为 JSONB；updateWithVersion 以 version 条件更新实现 compare-and-swap。
 * </p>
 *
 * @author taskmesh
 * @since 2026-09-02
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "plan-store.type", havingValue = "jdbc", matchIfMissing = true)
public class TaskPlanRepositoryImpl implements ITaskPlanRepository {

    private final TaskPlanDao taskPlanDao;
    private final TaskPlanConverter taskPlanConverter;

    public TaskPlanRepositoryImpl(TaskPlanDao taskPlanDao, TaskPlanConverter taskPlanConverter) {
        this.taskPlanDao = taskPlanDao;
        this.taskPlanConverter = taskPlanConverter;
    }

    @Override
    public TaskPlanEntity findBySessionId(String sessionId) {
        TaskPlanPO po = taskPlanDao.selectBySessionId(sessionId);
        return po != null ? taskPlanConverter.toEntity(po) : null;
    }

    @Override
    public boolean insert(TaskPlanEntity plan) {
        return taskPlanDao.insertIfAbsent(taskPlanConverter.toPO(plan)) > 0;
    }

    @Override
    public boolean updateWithVersion(TaskPlanEntity plan) {
        Long oldVersion = plan.getVersion();
        if (oldVersion == null) {
            throw new IllegalStateException("Version cannot be null for plan update: " + plan.getSessionId());
        }
        int affected = taskPlanDao.updateWithVersion(taskPlanConverter.toPO(plan));
        if (affected == 0) {
            return false;
        }
        plan.setVersion(oldVersion + 1);
        return true;
    }

    @Override
    public boolean deleteBySessionId(String sessionId) {
        return taskPlanDao.deleteBySessionId(sessionId) > 0;
    }

    @Override
    public List<String> findUnsettledSessionIds(int limit, TaskRetryPolicy retryPolicy) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return taskPlanDao.selectUnsettledSessionIds(limit, Math.max(retryPolicy.maxAttempts(), 1));
    }
}
