package com.taskmesh.infrastructure.dao.po;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 任务记录的持久化布局（task_plan.tasks 数组元素）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanTaskPO {

    private String id;

    @JsonProperty("agent_type")
    private String agentType;

    private String description;

    private List<String> dependencies;

    private String category;

    @JsonProperty("reference_type")
    private String referenceType;

    private String status;

    private String result;

    @JsonProperty("error_kind")
    private String errorKind;

    @JsonProperty("error_message")
    private String errorMessage;

    private List<String> tags;

    @JsonProperty("attempt_count")
    private Integer attemptCount;

    private Boolean obsolete;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;
}
