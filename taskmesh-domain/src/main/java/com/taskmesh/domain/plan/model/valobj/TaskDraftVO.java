package com.taskmesh.domain.plan.model.valobj;

import com.taskmesh.types.enums.ReferenceTypeEnum;
import com.taskmesh.types.enums.TaskCategoryEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 计划生成器输出的任务草稿，依赖使用草稿内引用（或已存在任务的 id）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskDraftVO {

    private String ref;

    private String agentType;

    private String description;

    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    private TaskCategoryEnum category;

    private ReferenceTypeEnum referenceType;

    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
