package com.taskmesh.infrastructure.repository.plan;

import com.taskmesh.domain.plan.adapter.repository.ITaskPlanRepository;
import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.domain.plan.model.entity.TaskPlanEntity;
import com.taskmesh.domain.task.model.valobj.TaskRetryPolicy;
import com.taskmesh.infrastructure.dao.po.TaskPlanPO;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * 内存计划仓储，保存序列化后的快照，读写双方不共享可变对象。
 */
@Repository
@ConditionalOnProperty(name = "plan-store.type", havingValue = "memory")
public class InMemoryTaskPlanRepository implements ITaskPlanRepository {

    private final ConcurrentMap<String, TaskPlanPO> plans = new ConcurrentHashMap<>();
    private final TaskPlanConverter taskPlanConverter;

    public InMemoryTaskPlanRepository(TaskPlanConverter taskPlanConverter) {
        this.taskPlanConverter = taskPlanConverter;
    }

    @Override
    public TaskPlanEntity findBySessionId(String sessionId) {
        TaskPlanPO po = sessionId == null ? null : plans.get(sessionId);
        return po != null ? taskPlanConverter.toEntity(po) : null;
    }

    @Override
    public boolean insert(TaskPlanEntity plan) {
        return plans.putIfAbsent(plan.getSessionId(), taskPlanConverter.toPO(plan)) == null;
    }

    @Override
    public boolean updateWithVersion(TaskPlanEntity plan) {
        Long oldVersion = plan.getVersion();
        if (oldVersion == null) {
            throw new IllegalStateException("Version cannot be null for plan update: " + plan.getSessionId());
        }
        TaskPlanPO next = taskPlanConverter.toPO(plan);
        next.setVersion(oldVersion + 1);
        TaskPlanPO stored = plans.computeIfPresent(plan.getSessionId(),
                (key, current) -> Objects.equals(current.getVersion(), oldVersion) ? next : current);
        if (stored != next) {
            return false;
        }
        plan.setVersion(next.getVersion());
        return true;
    }

    @Override
    public boolean deleteBySessionId(String sessionId) {
        return sessionId != null && plans.remove(sessionId) != null;
    }

    @Override
    public List<String> findUnsettledSessionIds(int limit, TaskRetryPolicy retryPolicy) {
        return plans.values().stream()
                .sorted(Comparator.comparing(TaskPlanPO::getUpdatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(taskPlanConverter::toEntity)
                .filter(plan -> plan.getTasks().stream().anyMatch(task -> isUnsettled(task, retryPolicy)))
                .map(TaskPlanEntity::getSessionId)
                .limit(Math.max(limit, 0))
                .collect(Collectors.toList());
    }

    private boolean isUnsettled(PlanTaskEntity task, TaskRetryPolicy retryPolicy) {
        return !task.isObsolete()
                && (task.getStatus().isUnsettled() || retryPolicy.isRetryPending(task));
    }
}
