package com.taskmesh.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 计划详情 DTO。
 */
@Data
public class PlanDetailDTO {

    private String sessionId;
    private String instruction;
    private Long version;
    private List<TaskDetailDTO> tasks;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
