package com.taskmesh.trigger.application.command;

import com.taskmesh.api.dto.TaskUpdateRequestDTO;
import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.domain.plan.model.valobj.TaskErrorVO;
import com.taskmesh.domain.plan.model.valobj.TaskPatchVO;
import com.taskmesh.domain.plan.service.PlanStoreService;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.enums.TaskErrorKindEnum;
import com.taskmesh.types.enums.TaskStatusEnum;
import com.taskmesh.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * 任务人工干预命令服务：状态/结果修正、失败重试。
 */
@Slf4j
@Service
public class TaskActionCommandService {

    private final PlanStoreService planStoreService;

    public TaskActionCommandService(PlanStoreService planStoreService) {
        this.planStoreService = planStoreService;
    }

    public PlanTaskEntity updateTask(String sessionId, String taskId, TaskUpdateRequestDTO request) {
        if (request == null) {
            throw illegal("请求体不能为空");
        }
        TaskPatchVO patch = TaskPatchVO.builder()
                .status(parseStatus(request.getStatus()))
                .result(request.getResult())
                .error(parseError(request))
                .obsolete(request.getObsolete())
                .build();
        PlanTaskEntity task = planStoreService.updateTask(sessionId, taskId, patch);
        log.info("Task updated manually. sessionId={}, taskId={}, status={}",
                sessionId, taskId, task.getStatus().getCode());
        return task;
    }

    /**
     * failed → pending，清空错误与派发次数；阻塞的下游任务交由下一轮依赖解析重新判定。
     */
    public PlanTaskEntity retryFromFailed(String sessionId, String taskId) {
        PlanTaskEntity task = planStoreService.getPlan(sessionId).requireTask(taskId);
        if (task.getStatus() != TaskStatusEnum.FAILED) {
            throw new AppException(ResponseCode.INVALID_TRANSITION, "仅 failed 任务允许重试: " + taskId);
        }
        return planStoreService.updateTask(sessionId, taskId,
                TaskPatchVO.builder().status(TaskStatusEnum.PENDING).build());
    }

    private TaskStatusEnum parseStatus(String status) {
        if (StringUtils.isBlank(status)) {
            return null;
        }
        try {
            return TaskStatusEnum.fromCode(status.trim());
        } catch (IllegalArgumentException ex) {
            throw illegal("未知任务状态: " + status);
        }
    }

    private TaskErrorVO parseError(TaskUpdateRequestDTO request) {
        if (StringUtils.isBlank(request.getErrorKind()) && StringUtils.isBlank(request.getErrorMessage())) {
            return null;
        }
        TaskErrorKindEnum kind = TaskErrorKindEnum.WORKER_ERROR;
        if (StringUtils.isNotBlank(request.getErrorKind())) {
            try {
                kind = TaskErrorKindEnum.fromCode(request.getErrorKind().trim());
            } catch (IllegalArgumentException ex) {
                throw illegal("未知错误类型: " + request.getErrorKind());
            }
        }
        return new TaskErrorVO(kind, request.getErrorMessage());
    }

    private AppException illegal(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER, message);
    }
}
