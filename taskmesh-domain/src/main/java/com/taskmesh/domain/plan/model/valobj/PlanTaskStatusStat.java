package com.taskmesh.domain.plan.model.valobj;

import com.taskmesh.types.enums.PlanProgressEnum;
import lombok.Builder;
import lombok.Data;

/**
 * 计划任务状态统计，obsolete 任务单独计数，不计入各状态。
 */
@Data
@Builder
public class PlanTaskStatusStat {

    private String sessionId;
    private long total;
    private long pendingCount;
    private long readyCount;
    private long runningCount;
    private long completedCount;
    private long failedCount;
    private long blockedCount;
    private long obsoleteCount;
    private PlanProgressEnum progress;
}
