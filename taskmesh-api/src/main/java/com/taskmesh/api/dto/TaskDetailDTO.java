package com.taskmesh.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 任务详情 DTO。
 */
@Data
public class TaskDetailDTO {

    private String taskId;
    private String agentType;
    private String description;
    private List<String> dependencies;
    private String category;
    private String referenceType;
    private String status;
    private String result;
    private String errorKind;
    private String errorMessage;
    private List<String> tags;
    private Integer attemptCount;
    private Boolean obsolete;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
