package com.taskmesh.api.dto;

import lombok.Data;

/**
 * 已注册 worker 摘要 DTO。
 */
@Data
public class AgentSummaryDTO {

    private String agentType;
    private String description;
}
