package com.taskmesh.domain.plan.service;

import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.domain.plan.model.entity.TaskPlanEntity;
import com.taskmesh.domain.plan.model.valobj.PlanTaskStatusStat;
import com.taskmesh.domain.task.model.valobj.TaskRetryPolicy;
import com.taskmesh.types.enums.PlanProgressEnum;
import com.taskmesh.types.enums.TaskStatusEnum;
import org.springframework.stereotype.Service;

/**
 * 计划进度领域服务：统计各状态任务数并给出 in_progress / completed / stuck 结论。
 */
@Service
public class PlanProgressDomainService {

    public PlanTaskStatusStat summarize(TaskPlanEntity plan, TaskRetryPolicy retryPolicy) {
        long pending = 0;
        long ready = 0;
        long running = 0;
        long completed = 0;
        long failed = 0;
        long blocked = 0;
        long obsolete = 0;
        boolean retryPending = false;
        for (PlanTaskEntity task : plan.getTasks()) {
            if (task.isObsolete()) {
                obsolete++;
                continue;
            }
            TaskStatusEnum status = task.getStatus();
            if (status == null) {
                continue;
            }
            switch (status) {
                case PENDING -> pending++;
                case READY -> ready++;
                case RUNNING -> running++;
                case COMPLETED -> completed++;
                case FAILED -> {
                    failed++;
                    retryPending |= retryPolicy.isRetryPending(task);
                }
                case BLOCKED -> blocked++;
                default -> {
                }
            }
        }
        return PlanTaskStatusStat.builder()
                .sessionId(plan.getSessionId())
                .total(plan.getTasks().size())
                .pendingCount(pending)
                .readyCount(ready)
                .runningCount(running)
                .completedCount(completed)
                .failedCount(failed)
                .blockedCount(blocked)
                .obsoleteCount(obsolete)
                .progress(resolveProgress(pending + ready + running, failed + blocked, retryPending))
                .build();
    }

    private PlanProgressEnum resolveProgress(long unsettled, long unsuccessful, boolean retryPending) {
        if (unsettled > 0 || retryPending) {
            return PlanProgressEnum.IN_PROGRESS;
        }
        if (unsuccessful > 0) {
            return PlanProgressEnum.STUCK;
        }
        return PlanProgressEnum.COMPLETED;
    }
}
