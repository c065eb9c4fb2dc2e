package com.taskmesh.domain.plan.service;

import com.taskmesh.domain.plan.adapter.repository.ITaskPlanRepository;
import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.domain.plan.model.entity.TaskPlanEntity;
import com.taskmesh.domain.plan.model.valobj.TaskDraftVO;
import com.taskmesh.domain.plan.model.valobj.TaskPatchVO;
import com.taskmesh.domain.task.model.valobj.DependencyResolution;
import com.taskmesh.domain.task.model.valobj.TaskRetryPolicy;
import com.taskmesh.domain.task.service.DependencyResolverDomainService;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.enums.TaskStatusEnum;
import com.taskmesh.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 计划存储领域服务。
 * <p>
 * 所有状态变更都经由此处：读取计划、在副本上校验并修改、按版本号 compare-and-swap 写回，冲突时重读重试。
 * 校验失败直接抛出异常，不会写入任何部分结果。
 * </p>
 *
 * @author taskmesh
 * @since 2026-09-02
 */
@Slf4j
@Service
public class PlanStoreService {

    private final ITaskPlanRepository taskPlanRepository;
    private final PlanGraphDomainService planGraphDomainService;
    private final DependencyResolverDomainService dependencyResolverDomainService;
    private final PlanDraftDomainService planDraftDomainService;
    private final int maxCasRetries;

    public PlanStoreService(ITaskPlanRepository taskPlanRepository,
                            PlanGraphDomainService planGraphDomainService,
                            DependencyResolverDomainService dependencyResolverDomainService,
                            PlanDraftDomainService planDraftDomainService,
                            @Value("${plan-store.max-cas-retries:16}") int maxCasRetries) {
        this.taskPlanRepository = taskPlanRepository;
        this.planGraphDomainService = planGraphDomainService;
        this.dependencyResolverDomainService = dependencyResolverDomainService;
        this.planDraftDomainService = planDraftDomainService;
        this.maxCasRetries = Math.max(maxCasRetries, 1);
    }

    public TaskPlanEntity createPlan(String sessionId, List<PlanTaskEntity> tasks) {
        return createPlan(sessionId, null, tasks);
    }

    public TaskPlanEntity createPlan(String sessionId, String instruction, List<PlanTaskEntity> tasks) {
        requireSessionId(sessionId);
        List<PlanTaskEntity> initialTasks = tasks == null ? new ArrayList<>() : new ArrayList<>(tasks);
        LocalDateTime now = LocalDateTime.now();
        for (PlanTaskEntity task : initialTasks) {
            prepareNewTask(task, now);
        }
        planGraphDomainService.validate(initialTasks);

        TaskPlanEntity plan = new TaskPlanEntity();
        plan.setSessionId(sessionId);
        plan.setInstruction(instruction);
        plan.setTasks(initialTasks);
        plan.setVersion(0L);
        plan.setCreatedAt(now);
        plan.setUpdatedAt(now);
        if (!taskPlanRepository.insert(plan)) {
            throw new AppException(ResponseCode.DUPLICATE_PLAN, "Plan already exists for session: " + sessionId);
        }
        log.info("Plan created. sessionId={}, taskCount={}", sessionId, initialTasks.size());
        return plan;
    }

    public TaskPlanEntity getPlan(String sessionId) {
        requireSessionId(sessionId);
        TaskPlanEntity plan = taskPlanRepository.findBySessionId(sessionId);
        if (plan == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Plan not found for session: " + sessionId);
        }
        return plan;
    }

    public TaskPlanEntity appendTasks(String sessionId, List<PlanTaskEntity> newTasks) {
        if (newTasks == null || newTasks.isEmpty()) {
            return getPlan(sessionId);
        }
        return mutate(sessionId, plan -> Outcome.changed(appendValidated(plan, newTasks)));
    }

    /**
     * 动态重规划追加：在同一次 compare-and-swap 内分配 id，避免并发追加产生重复 id。
     *
     * @return 追加的任务
     */
    public List<PlanTaskEntity> appendDrafts(String sessionId, List<TaskDraftVO> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            return List.of();
        }
        return mutate(sessionId, plan -> {
            List<PlanTaskEntity> newTasks = planDraftDomainService.toTasks(plan.getTasks(), drafts);
            appendValidated(plan, newTasks);
            return Outcome.changed(newTasks);
        });
    }

    public PlanTaskEntity updateTask(String sessionId, String taskId, TaskPatchVO patch) {
        if (patch == null || patch.isEmpty()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Task patch cannot be empty");
        }
        return mutate(sessionId, plan -> {
            PlanTaskEntity task = plan.requireTask(taskId);
            return applyPatch(plan, task, patch) ? Outcome.changed(task) : Outcome.unchanged(task);
        });
    }

    /**
     * 运行依赖解析并在一次写入中应用 ready/blocked 流转。
     */
    public DependencyResolution applyResolution(String sessionId, TaskRetryPolicy retryPolicy) {
        return mutate(sessionId, plan -> {
            DependencyResolution resolution = dependencyResolverDomainService.resolve(plan.getTasks(), retryPolicy);
            if (!resolution.hasChanges()) {
                return Outcome.unchanged(resolution);
            }
            resolution.ready().forEach(id -> plan.requireTask(id).markReady());
            resolution.newlyBlocked().forEach(id -> plan.requireTask(id).markBlocked());
            log.debug("Dependency resolution applied. sessionId={}, ready={}, blocked={}",
                    sessionId, resolution.ready(), resolution.newlyBlocked());
            return Outcome.changed(resolution);
        });
    }

    /**
     * 将退避已到期、仍有重试预算的失败任务放回 pending，返回被重试的任务 id。
     */
    public List<String> retryDueTasks(String sessionId, TaskRetryPolicy retryPolicy) {
        return mutate(sessionId, plan -> {
            List<PlanTaskEntity> due = dependencyResolverDomainService.retryDue(
                    plan.getTasks(), retryPolicy, LocalDateTime.now());
            if (due.isEmpty()) {
                return Outcome.unchanged(List.<String>of());
            }
            due.forEach(task -> task.resetForRetry(false));
            List<String> ids = due.stream().map(PlanTaskEntity::getId).collect(Collectors.toList());
            log.info("Failed tasks scheduled for retry. sessionId={}, taskIds={}", sessionId, ids);
            return Outcome.changed(ids);
        });
    }

    public void deletePlan(String sessionId) {
        requireSessionId(sessionId);
        if (taskPlanRepository.deleteBySessionId(sessionId)) {
            log.info("Plan deleted. sessionId={}", sessionId);
        }
    }

    public List<String> findUnsettledSessionIds(int limit, TaskRetryPolicy retryPolicy) {
        return taskPlanRepository.findUnsettledSessionIds(limit,
                retryPolicy == null ? TaskRetryPolicy.noRetry() : retryPolicy);
    }

    private TaskPlanEntity appendValidated(TaskPlanEntity plan, List<PlanTaskEntity> newTasks) {
        LocalDateTime now = LocalDateTime.now();
        List<PlanTaskEntity> union = new ArrayList<>(plan.getTasks());
        for (PlanTaskEntity task : newTasks) {
            prepareNewTask(task, now);
            union.add(task);
        }
        planGraphDomainService.validate(union);
        plan.setTasks(union);
        log.info("Tasks appended. sessionId={}, appended={}, total={}",
                plan.getSessionId(), newTasks.size(), union.size());
        return plan;
    }

    /**
     * @return 任务是否发生变化；无变化时不写回，版本号保持不变
     */
    private boolean applyPatch(TaskPlanEntity plan, PlanTaskEntity task, TaskPatchVO patch) {
        TaskStatusEnum target = patch.getStatus();
        if (patch.getError() != null && target != null && target != TaskStatusEnum.FAILED) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER,
                    "Error can only accompany status failed: " + task.getId());
        }
        boolean changed = false;
        if (target != null) {
            switch (target) {
                case READY -> task.markReady();
                case BLOCKED -> task.markBlocked();
                case RUNNING -> task.start();
                case COMPLETED -> task.complete(patch.getResult());
                case FAILED -> task.fail(patch.getError());
                case PENDING -> resetToPending(plan, task);
            }
            changed = true;
        } else {
            if (patch.getResult() != null) {
                changed = task.overrideResult(patch.getResult());
            }
            if (patch.getError() != null) {
                changed |= task.overrideError(patch.getError());
            }
        }
        if (patch.getObsolete() != null) {
            changed |= task.markObsolete(patch.getObsolete());
        }
        return changed;
    }

    private void resetToPending(TaskPlanEntity plan, PlanTaskEntity task) {
        if (task.getStatus() == TaskStatusEnum.BLOCKED) {
            task.unblock();
            return;
        }
        task.resetForRetry(true);
        // 只放开被该任务拖住的下游，其它失败导致的阻塞保持不变；依赖解析会重新判定
        for (String dependentId : transitiveDependents(plan, task.getId())) {
            PlanTaskEntity dependent = plan.requireTask(dependentId);
            if (dependent.getStatus() == TaskStatusEnum.BLOCKED) {
                dependent.unblock();
            }
        }
    }

    private Set<String> transitiveDependents(TaskPlanEntity plan, String taskId) {
        Set<String> dependents = new LinkedHashSet<>();
        Deque<String> frontier = new ArrayDeque<>(List.of(taskId));
        while (!frontier.isEmpty()) {
            String current = frontier.poll();
            for (PlanTaskEntity candidate : plan.getTasks()) {
                if (candidate.safeDependencies().contains(current) && dependents.add(candidate.getId())) {
                    frontier.add(candidate.getId());
                }
            }
        }
        return dependents;
    }

    private <T> T mutate(String sessionId, Function<TaskPlanEntity, Outcome<T>> mutation) {
        for (int attempt = 1; attempt <= maxCasRetries; attempt++) {
            TaskPlanEntity plan = getPlan(sessionId);
            Outcome<T> outcome = mutation.apply(plan);
            if (!outcome.changed()) {
                return outcome.value();
            }
            plan.touch();
            if (taskPlanRepository.updateWithVersion(plan)) {
                return outcome.value();
            }
            log.debug("Plan version conflict, retrying. sessionId={}, attempt={}", sessionId, attempt);
        }
        throw new AppException(ResponseCode.UN_ERROR, "Optimistic lock failed for plan: " + sessionId);
    }

    private void prepareNewTask(PlanTaskEntity task, LocalDateTime now) {
        if (task == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Task cannot be null");
        }
        task.setStatus(TaskStatusEnum.PENDING);
        task.setResult(null);
        task.setError(null);
        task.setAttemptCount(0);
        if (task.getDependencies() == null) {
            task.setDependencies(new ArrayList<>());
        }
        if (task.getTags() == null) {
            task.setTags(new ArrayList<>());
        }
        if (task.getCreatedAt() == null) {
            task.setCreatedAt(now);
        }
        task.setUpdatedAt(task.getCreatedAt());
        task.validate();
    }

    private void requireSessionId(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "SessionId cannot be empty");
        }
    }

    private record Outcome<T>(T value, boolean changed) {

        static <T> Outcome<T> changed(T value) {
            return new Outcome<>(value, true);
        }

        static <T> Outcome<T> unchanged(T value) {
            return new Outcome<>(value, false);
        }
    }
}
