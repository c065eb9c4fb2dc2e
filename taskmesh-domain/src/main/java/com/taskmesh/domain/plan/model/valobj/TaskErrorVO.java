package com.taskmesh.domain.plan.model.valobj;

import com.taskmesh.types.enums.TaskErrorKindEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 任务失败信息值对象
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskErrorVO {

    private TaskErrorKindEnum kind;

    private String message;

    public static TaskErrorVO workerError(String message) {
        return new TaskErrorVO(TaskErrorKindEnum.WORKER_ERROR, message);
    }

    public static TaskErrorVO timeout(String message) {
        return new TaskErrorVO(TaskErrorKindEnum.TIMEOUT, message);
    }
}
