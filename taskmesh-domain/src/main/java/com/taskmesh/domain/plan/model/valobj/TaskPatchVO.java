package com.taskmesh.domain.plan.model.valobj;

import com.taskmesh.types.enums.TaskStatusEnum;
import lombok.Builder;
import lombok.Data;

/**
 * 任务变更补丁：字段为空表示不修改。
 */
@Data
@Builder
public class TaskPatchVO {

    private TaskStatusEnum status;

    private String result;

    private TaskErrorVO error;

    private Boolean obsolete;

    public boolean isEmpty() {
        return status == null && result == null && error == null && obsolete == null;
    }
}
