package com.taskmesh.infrastructure.repository.plan;

import com.fasterxml.jackson.core.type.TypeReference;
import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.domain.plan.model.entity.TaskPlanEntity;
import com.taskmesh.domain.plan.model.valobj.TaskErrorVO;
import com.taskmesh.infrastructure.dao.po.PlanTaskPO;
import com.taskmesh.infrastructure.dao.po.TaskPlanPO;
import com.taskmesh.infrastructure.util.JsonCodec;
import com.taskmesh.types.enums.ReferenceTypeEnum;
import com.taskmesh.types.enums.TaskCategoryEnum;
import com.taskmesh.types.enums.TaskErrorKindEnum;
import com.taskmesh.types.enums.TaskStatusEnum;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 计划 Entity 与持久化布局之间的转换，任务列表序列化为 JSON 数组。
 */
@Component
public class TaskPlanConverter {

    private static final TypeReference<List<PlanTaskPO>> TASK_LIST_REF = new TypeReference<List<PlanTaskPO>>() {};

    private final JsonCodec jsonCodec;

    public TaskPlanConverter(JsonCodec jsonCodec) {
        this.jsonCodec = jsonCodec;
    }

    public TaskPlanPO toPO(TaskPlanEntity entity) {
        List<PlanTaskPO> tasks = entity.getTasks() == null
                ? new ArrayList<>()
                : entity.getTasks().stream().map(this::toTaskPO).collect(Collectors.toList());
        return TaskPlanPO.builder()
                .sessionId(entity.getSessionId())
                .instruction(entity.getInstruction())
                .tasks(jsonCodec.writeValue(tasks))
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public TaskPlanEntity toEntity(TaskPlanPO po) {
        TaskPlanEntity entity = new TaskPlanEntity();
        entity.setSessionId(po.getSessionId());
        entity.setInstruction(po.getInstruction());
        List<PlanTaskPO> tasks = jsonCodec.readValue(po.getTasks(), TASK_LIST_REF);
        entity.setTasks(tasks == null
                ? new ArrayList<>()
                : tasks.stream().map(this::toTaskEntity).collect(Collectors.toList()));
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private PlanTaskPO toTaskPO(PlanTaskEntity task) {
        TaskErrorVO error = task.getError();
        return PlanTaskPO.builder()
                .id(task.getId())
                .agentType(task.getAgentType())
                .description(task.getDescription())
                .dependencies(new ArrayList<>(task.safeDependencies()))
                .category(task.getCategory() == null ? null : task.getCategory().getCode())
                .referenceType(task.getReferenceType() == null ? null : task.getReferenceType().getCode())
                .status(task.getStatus() == null ? null : task.getStatus().getCode())
                .result(task.getResult())
                .errorKind(error == null || error.getKind() == null ? null : error.getKind().getCode())
                .errorMessage(error == null ? null : error.getMessage())
                .tags(task.getTags() == null ? new ArrayList<>() : new ArrayList<>(task.getTags()))
                .attemptCount(task.getAttemptCount())
                .obsolete(task.isObsolete())
                .createdAt(task.getCreatedAt())
                .updatedAt(task.getUpdatedAt())
                .build();
    }

    private PlanTaskEntity toTaskEntity(PlanTaskPO po) {
        PlanTaskEntity task = new PlanTaskEntity();
        task.setId(po.getId());
        task.setAgentType(po.getAgentType());
        task.setDescription(po.getDescription());
        task.setDependencies(po.getDependencies() == null ? new ArrayList<>() : new ArrayList<>(po.getDependencies()));
        task.setCategory(TaskCategoryEnum.fromCode(po.getCategory()));
        task.setReferenceType(ReferenceTypeEnum.fromCode(po.getReferenceType()));
        task.setStatus(TaskStatusEnum.fromCode(po.getStatus()));
        task.setResult(po.getResult());
        if (po.getErrorKind() != null || po.getErrorMessage() != null) {
            task.setError(new TaskErrorVO(TaskErrorKindEnum.fromCode(po.getErrorKind()), po.getErrorMessage()));
        }
        task.setTags(po.getTags() == null ? new ArrayList<>() : new ArrayList<>(po.getTags()));
        task.setAttemptCount(po.getAttemptCount() == null ? 0 : po.getAttemptCount());
        task.setObsolete(Boolean.TRUE.equals(po.getObsolete()));
        task.setCreatedAt(po.getCreatedAt());
        task.setUpdatedAt(po.getUpdatedAt());
        return task;
    }
}
