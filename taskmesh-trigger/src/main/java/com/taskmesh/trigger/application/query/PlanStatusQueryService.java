package com.taskmesh.trigger.application.query;

import com.taskmesh.api.dto.PlanStatusDTO;
import com.taskmesh.domain.plan.model.entity.TaskPlanEntity;
import com.taskmesh.domain.plan.model.valobj.PlanTaskStatusStat;
import com.taskmesh.domain.plan.service.PlanProgressDomainService;
import com.taskmesh.domain.plan.service.PlanStoreService;
import com.taskmesh.trigger.application.common.PlanExecutionProperties;
import com.taskmesh.trigger.application.common.TaskDetailViewAssembler;
import org.springframework.stereotype.Service;

/**
 * 计划状态查询：只读投影。
 */
@Service
public class PlanStatusQueryService {

    private final PlanStoreService planStoreService;
    private final PlanProgressDomainService planProgressDomainService;
    private final TaskDetailViewAssembler taskDetailViewAssembler;
    private final PlanExecutionProperties planExecutionProperties;

    public PlanStatusQueryService(PlanStoreService planStoreService,
                                  PlanProgressDomainService planProgressDomainService,
                                  TaskDetailViewAssembler taskDetailViewAssembler,
                                  PlanExecutionProperties planExecutionProperties) {
        this.planStoreService = planStoreService;
        this.planProgressDomainService = planProgressDomainService;
        this.taskDetailViewAssembler = taskDetailViewAssembler;
        this.planExecutionProperties = planExecutionProperties;
    }

    public PlanStatusDTO getStatus(String sessionId) {
        TaskPlanEntity plan = planStoreService.getPlan(sessionId);
        PlanTaskStatusStat stat = planProgressDomainService.summarize(plan, planExecutionProperties.toRetryPolicy());

        PlanStatusDTO dto = new PlanStatusDTO();
        dto.setSessionId(plan.getSessionId());
        dto.setProgress(stat.getProgress().getCode());
        dto.setStats(taskDetailViewAssembler.toStatsDTO(stat));
        dto.setTasks(taskDetailViewAssembler.toTaskDetailDTOs(plan.getTasks()));
        dto.setUpdatedAt(plan.getUpdatedAt());
        return dto;
    }
}
