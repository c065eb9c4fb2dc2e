package com.taskmesh.domain.task.service;

import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.domain.plan.model.entity.TaskPlanEntity;
import com.taskmesh.types.enums.TaskStatusEnum;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Task 输入领域服务：按依赖顺序收集已完成的信息参照任务结果，作为 worker 的注入上下文。
 */
@Service
public class TaskInputDomainService {

    public Map<String, String> buildInjectedContext(TaskPlanEntity plan, PlanTaskEntity task) {
        Map<String, String> context = new LinkedHashMap<>();
        if (plan == null || task == null) {
            return context;
        }
        for (String depId : task.safeDependencies()) {
            plan.findTask(depId)
                    .filter(PlanTaskEntity::isInfoReference)
                    .filter(dep -> dep.getStatus() == TaskStatusEnum.COMPLETED)
                    .ifPresent(dep -> context.put(dep.getId(), dep.getResult() == null ? "" : dep.getResult()));
        }
        return context;
    }
}
