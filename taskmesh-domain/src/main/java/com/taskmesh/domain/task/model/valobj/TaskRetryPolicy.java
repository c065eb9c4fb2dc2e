package com.taskmesh.domain.task.model.valobj;

import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.types.enums.TaskStatusEnum;

import java.time.LocalDateTime;

/**
 * 失败任务的自动重试策略：指数退避，delay = base * multiplier^(attempt-1)，上限 maxDelay。
 *
 * @param maxAttempts 每个任务最多派发次数，1 表示不自动重试
 * @param baseDelayMs 首次重试等待
 * @param multiplier  退避倍数
 * @param maxDelayMs  等待上限
 */
public record TaskRetryPolicy(int maxAttempts, long baseDelayMs, double multiplier, long maxDelayMs) {

    public static TaskRetryPolicy noRetry() {
        return new TaskRetryPolicy(1, 0L, 1.0D, 0L);
    }

    public boolean hasRetryBudget(PlanTaskEntity task) {
        return task != null && task.getAttemptCount() < Math.max(maxAttempts, 1);
    }

    /**
     * 失败任务是否仍会被自动重试（依赖它的任务应等待而不是阻塞）。
     */
    public boolean isRetryPending(PlanTaskEntity task) {
        return task != null
                && task.getStatus() == TaskStatusEnum.FAILED
                && !task.isObsolete()
                && hasRetryBudget(task);
    }

    public long delayMillis(int attempt) {
        if (attempt <= 0 || baseDelayMs <= 0) {
            return 0L;
        }
        double delay = baseDelayMs * Math.pow(Math.max(multiplier, 1.0D), attempt - 1);
        return (long) Math.min(delay, (double) Math.max(maxDelayMs, baseDelayMs));
    }

    public LocalDateTime retryDueAt(PlanTaskEntity task) {
        LocalDateTime failedAt = task.getUpdatedAt() == null ? LocalDateTime.now() : task.getUpdatedAt();
        return failedAt.plusNanos(delayMillis(task.getAttemptCount()) * 1_000_000L);
    }

    public boolean isRetryDue(PlanTaskEntity task, LocalDateTime now) {
        return isRetryPending(task) && !retryDueAt(task).isAfter(now);
    }
}
