package com.taskmesh.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 计划状态 DTO：进度结论 + 统计 + 任务列表。
 */
@Data
public class PlanStatusDTO {

    private String sessionId;
    private String progress;
    private PlanTaskStatsDTO stats;
    private List<TaskDetailDTO> tasks;
    private LocalDateTime updatedAt;
}
