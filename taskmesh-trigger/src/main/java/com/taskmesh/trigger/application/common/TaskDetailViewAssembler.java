package com.taskmesh.trigger.application.common;

import com.taskmesh.api.dto.PlanDetailDTO;
import com.taskmesh.api.dto.PlanTaskStatsDTO;
import com.taskmesh.api.dto.TaskDetailDTO;
import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.domain.plan.model.entity.TaskPlanEntity;
import com.taskmesh.domain.plan.model.valobj.PlanTaskStatusStat;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Task 详情视图组装器：统一计划、任务、统计的 DTO 映射。
 */
@Component
public class TaskDetailViewAssembler {

    public TaskDetailDTO toTaskDetailDTO(PlanTaskEntity task) {
        if (task == null) {
            return null;
        }
        TaskDetailDTO dto = new TaskDetailDTO();
        dto.setTaskId(task.getId());
        dto.setAgentType(task.getAgentType());
        dto.setDescription(task.getDescription());
        dto.setDependencies(new ArrayList<>(task.safeDependencies()));
        dto.setCategory(task.getCategory() == null ? null : task.getCategory().getCode());
        dto.setReferenceType(task.getReferenceType() == null ? null : task.getReferenceType().getCode());
        dto.setStatus(task.getStatus() == null ? null : task.getStatus().getCode());
        dto.setResult(task.getResult());
        if (task.getError() != null) {
            dto.setErrorKind(task.getError().getKind() == null ? null : task.getError().getKind().getCode());
            dto.setErrorMessage(task.getError().getMessage());
        }
        dto.setTags(task.getTags());
        dto.setAttemptCount(task.getAttemptCount());
        dto.setObsolete(task.isObsolete());
        dto.setCreatedAt(task.getCreatedAt());
        dto.setUpdatedAt(task.getUpdatedAt());
        return dto;
    }

    public List<TaskDetailDTO> toTaskDetailDTOs(List<PlanTaskEntity> tasks) {
        if (tasks == null) {
            return new ArrayList<>();
        }
        return tasks.stream().map(this::toTaskDetailDTO).collect(Collectors.toList());
    }

    public PlanDetailDTO toPlanDetailDTO(TaskPlanEntity plan) {
        PlanDetailDTO dto = new PlanDetailDTO();
        dto.setSessionId(plan.getSessionId());
        dto.setInstruction(plan.getInstruction());
        dto.setVersion(plan.getVersion());
        dto.setTasks(toTaskDetailDTOs(plan.getTasks()));
        dto.setCreatedAt(plan.getCreatedAt());
        dto.setUpdatedAt(plan.getUpdatedAt());
        return dto;
    }

    public PlanTaskStatsDTO toStatsDTO(PlanTaskStatusStat stat) {
        PlanTaskStatsDTO dto = new PlanTaskStatsDTO();
        dto.setTotal(stat.getTotal());
        dto.setPending(stat.getPendingCount());
        dto.setReady(stat.getReadyCount());
        dto.setRunning(stat.getRunningCount());
        dto.setCompleted(stat.getCompletedCount());
        dto.setFailed(stat.getFailedCount());
        dto.setBlocked(stat.getBlockedCount());
        dto.setObsolete(stat.getObsoleteCount());
        return dto;
    }
}
