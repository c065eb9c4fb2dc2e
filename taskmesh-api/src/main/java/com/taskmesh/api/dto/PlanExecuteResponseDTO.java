package com.taskmesh.api.dto;

import lombok.Data;

/**
 * 批量执行结果 DTO。
 */
@Data
public class PlanExecuteResponseDTO {

    private String sessionId;
    private Integer dispatchedCount;
    private Integer completedCount;
    private Integer failedCount;
    private Integer appendedCount;
    private PlanStatusDTO status;
}
