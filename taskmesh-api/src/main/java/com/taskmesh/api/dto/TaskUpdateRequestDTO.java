package com.taskmesh.api.dto;

import lombok.Data;

/**
 * 任务人工修正请求 DTO，字段均可选。
 */
@Data
public class TaskUpdateRequestDTO {

    private String status;
    private String result;
    private String errorKind;
    private String errorMessage;
    private Boolean obsolete;
}
