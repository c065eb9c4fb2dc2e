package com.taskmesh.domain.plan.model.entity;

import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.exception.AppException;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 计划聚合：一个会话至多一个计划，任务按插入顺序保存。
 *
 * @author taskmesh
 * @since 2026-09-02
 */
@Data
public class TaskPlanEntity {

    /**
     * 会话 ID
     */
    private String sessionId;

    /**
     * 原始指令
     */
    private String instruction;

    /**
     * 任务列表
     */
    private List<PlanTaskEntity> tasks = new ArrayList<>();

    /**
     * 版本号 (乐观锁)
     */
    private Long version;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    public Optional<PlanTaskEntity> findTask(String taskId) {
        if (taskId == null || tasks == null) {
            return Optional.empty();
        }
        return tasks.stream().filter(task -> taskId.equals(task.getId())).findFirst();
    }

    public PlanTaskEntity requireTask(String taskId) {
        return findTask(taskId).orElseThrow(() -> new AppException(ResponseCode.NOT_FOUND,
                "Task not found. sessionId=" + sessionId + ", taskId=" + taskId));
    }

    /**
     * 刷新计划更新时间，保证单调不减。
     */
    public void touch() {
        LocalDateTime now = LocalDateTime.now();
        this.updatedAt = updatedAt != null && updatedAt.isAfter(now) ? updatedAt : now;
    }
}
