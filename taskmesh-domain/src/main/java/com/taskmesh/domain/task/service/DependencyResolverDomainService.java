package com.taskmesh.domain.task.service;

import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.domain.task.model.valobj.DependencyResolution;
import com.taskmesh.domain.task.model.valobj.TaskRetryPolicy;
import com.taskmesh.types.enums.TaskStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 依赖解析领域服务：纯函数，不修改入参，也不持有状态。
 * <p>
 * 任一依赖（直接或间接）处于 dead 状态时任务被阻塞。dead 指：blocked、obsolete，
 * 或 failed 且没有剩余重试预算。
 * </p>
 *
 * @author taskmesh
 * @since 2026-09-02
 */
@Slf4j
@Service
public class DependencyResolverDomainService {

    public static final Comparator<PlanTaskEntity> DISPATCH_ORDER = Comparator
            .comparing(PlanTaskEntity::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(PlanTaskEntity::getId);

    public enum DependencyDecision {
        SATISFIED,
        WAITING,
        BLOCKED
    }

    public DependencyResolution resolve(Collection<PlanTaskEntity> tasks, TaskRetryPolicy retryPolicy) {
        Map<String, PlanTaskEntity> tasksById = index(tasks);
        Map<String, Boolean> doomedMemo = new HashMap<>();

        List<PlanTaskEntity> ready = new ArrayList<>();
        List<PlanTaskEntity> stillPending = new ArrayList<>();
        List<PlanTaskEntity> newlyBlocked = new ArrayList<>();
        for (PlanTaskEntity task : tasksById.values()) {
            if (task.isObsolete()) {
                continue;
            }
            if (task.getStatus() == TaskStatusEnum.PENDING) {
                DependencyDecision decision = evaluate(task, tasksById, retryPolicy, doomedMemo);
                if (decision == DependencyDecision.SATISFIED) {
                    ready.add(task);
                } else if (decision == DependencyDecision.BLOCKED) {
                    newlyBlocked.add(task);
                } else {
                    stillPending.add(task);
                }
            } else if (task.getStatus() == TaskStatusEnum.READY
                    && evaluate(task, tasksById, retryPolicy, doomedMemo) == DependencyDecision.BLOCKED) {
                newlyBlocked.add(task);
            }
        }
        return new DependencyResolution(ids(ready), ids(stillPending), ids(newlyBlocked));
    }

    /**
     * 当前可派发任务，按 (createdAt, id) 排序。
     */
    public List<PlanTaskEntity> dispatchOrder(Collection<PlanTaskEntity> tasks) {
        return tasks.stream()
                .filter(PlanTaskEntity::isDispatchable)
                .sorted(DISPATCH_ORDER)
                .collect(Collectors.toList());
    }

    /**
     * 可由策略重试且退避已到期的失败任务。
     */
    public List<PlanTaskEntity> retryDue(Collection<PlanTaskEntity> tasks,
                                         TaskRetryPolicy retryPolicy,
                                         LocalDateTime now) {
        return tasks.stream()
                .filter(task -> retryPolicy.isRetryDue(task, now))
                .sorted(DISPATCH_ORDER)
                .collect(Collectors.toList());
    }

    private DependencyDecision evaluate(PlanTaskEntity task,
                                        Map<String, PlanTaskEntity> tasksById,
                                        TaskRetryPolicy retryPolicy,
                                        Map<String, Boolean> doomedMemo) {
        boolean allCompleted = true;
        for (String depId : task.safeDependencies()) {
            PlanTaskEntity dep = tasksById.get(depId);
            if (dep == null) {
                log.warn("Dependency missing from plan, task keeps waiting. taskId={}, dependencyId={}",
                        task.getId(), depId);
                allCompleted = false;
                continue;
            }
            if (isDoomed(dep, tasksById, retryPolicy, doomedMemo, new HashSet<>())) {
                return DependencyDecision.BLOCKED;
            }
            if (dep.getStatus() != TaskStatusEnum.COMPLETED) {
                allCompleted = false;
            }
        }
        return allCompleted ? DependencyDecision.SATISFIED : DependencyDecision.WAITING;
    }

    private boolean isDoomed(PlanTaskEntity task,
                             Map<String, PlanTaskEntity> tasksById,
                             TaskRetryPolicy retryPolicy,
                             Map<String, Boolean> doomedMemo,
                             Set<String> visiting) {
        Boolean cached = doomedMemo.get(task.getId());
        if (cached != null) {
            return cached;
        }
        if (!visiting.add(task.getId())) {
            return false;
        }
        boolean doomed;
        if (task.isObsolete() || task.getStatus() == TaskStatusEnum.BLOCKED) {
            doomed = true;
        } else if (task.getStatus() == TaskStatusEnum.FAILED) {
            doomed = !retryPolicy.isRetryPending(task);
        } else if (task.getStatus() == TaskStatusEnum.PENDING || task.getStatus() == TaskStatusEnum.READY) {
            doomed = false;
            for (String depId : task.safeDependencies()) {
                PlanTaskEntity dep = tasksById.get(depId);
                if (dep != null && isDoomed(dep, tasksById, retryPolicy, doomedMemo, visiting)) {
                    doomed = true;
                    break;
                }
            }
        } else {
            doomed = false;
        }
        doomedMemo.put(task.getId(), doomed);
        return doomed;
    }

    private Map<String, PlanTaskEntity> index(Collection<PlanTaskEntity> tasks) {
        Map<String, PlanTaskEntity> tasksById = new LinkedHashMap<>();
        if (tasks != null) {
            for (PlanTaskEntity task : tasks) {
                if (task != null && task.getId() != null) {
                    tasksById.put(task.getId(), task);
                }
            }
        }
        return tasksById;
    }

    private List<String> ids(List<PlanTaskEntity> tasks) {
        tasks.sort(DISPATCH_ORDER);
        return tasks.stream().map(PlanTaskEntity::getId).collect(Collectors.toList());
    }
}
