package com.taskmesh.trigger.http;

import com.taskmesh.api.dto.PlanCreateRequestDTO;
import com.taskmesh.api.dto.PlanDetailDTO;
import com.taskmesh.api.dto.PlanExecuteResponseDTO;
import com.taskmesh.api.dto.PlanStatusDTO;
import com.taskmesh.api.dto.TaskDetailDTO;
import com.taskmesh.api.dto.TaskUpdateRequestDTO;
import com.taskmesh.api.response.Response;
import com.taskmesh.trigger.application.command.PlanExecutionService;
import com.taskmesh.trigger.application.command.TaskActionCommandService;
import com.taskmesh.trigger.application.common.TaskDetailViewAssembler;
import com.taskmesh.trigger.application.query.PlanStatusQueryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 计划 API：创建、批量执行、状态查询、任务修正与重试。
 */
@Slf4j
@RestController
@RequestMapping("/api/sessions/{sessionId}/plan")
public class PlanController {

    private final PlanExecutionService planExecutionService;
    private final PlanStatusQueryService planStatusQueryService;
    private final TaskActionCommandService taskActionCommandService;
    private final TaskDetailViewAssembler taskDetailViewAssembler;

    public PlanController(PlanExecutionService planExecutionService,
                          PlanStatusQueryService planStatusQueryService,
                          TaskActionCommandService taskActionCommandService,
                          TaskDetailViewAssembler taskDetailViewAssembler) {
        this.planExecutionService = planExecutionService;
        this.planStatusQueryService = planStatusQueryService;
        this.taskActionCommandService = taskActionCommandService;
        this.taskDetailViewAssembler = taskDetailViewAssembler;
    }

    @PostMapping
    public Response<PlanDetailDTO> createPlan(@PathVariable("sessionId") String sessionId,
                                              @RequestBody PlanCreateRequestDTO request) {
        String instruction = request == null ? null : request.getInstruction();
        return Response.success(taskDetailViewAssembler.toPlanDetailDTO(planExecutionService.createPlan(sessionId, instruction)));
    }

    @PostMapping("/execute")
    public Response<PlanExecuteResponseDTO> execute(@PathVariable("sessionId") String sessionId) {
        PlanExecutionService.ExecutionResult result = planExecutionService.executeReady(sessionId);
        log.info("Plan executed by request. sessionId={}, dispatched={}, completed={}, failed={}",
                sessionId, result.dispatchedCount(), result.completedCount(), result.failedCount());
        PlanExecuteResponseDTO dto = new PlanExecuteResponseDTO();
        dto.setSessionId(sessionId);
        dto.setDispatchedCount(result.dispatchedCount());
        dto.setCompletedCount(result.completedCount());
        dto.setFailedCount(result.failedCount());
        dto.setAppendedCount(result.appendedCount());
        dto.setStatus(planStatusQueryService.getStatus(sessionId));
        return Response.success(dto);
    }

    @GetMapping("/status")
    public Response<PlanStatusDTO> status(@PathVariable("sessionId") String sessionId) {
        return Response.success(planStatusQueryService.getStatus(sessionId));
    }

    @PatchMapping("/tasks/{taskId}")
    public Response<TaskDetailDTO> updateTask(@PathVariable("sessionId") String sessionId,
                                              @PathVariable("taskId") String taskId,
                                              @RequestBody TaskUpdateRequestDTO request) {
        return Response.success(taskDetailViewAssembler.toTaskDetailDTO(
                taskActionCommandService.updateTask(sessionId, taskId, request)));
    }

    @PostMapping("/tasks/{taskId}/retry")
    public Response<TaskDetailDTO> retry(@PathVariable("sessionId") String sessionId,
                                         @PathVariable("taskId") String taskId) {
        return Response.success(taskDetailViewAssembler.toTaskDetailDTO(
                taskActionCommandService.retryFromFailed(sessionId, taskId)));
    }
}
