package com.taskmesh.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 计划 PO，任务列表以 JSONB 内嵌保存
 *
 * @author taskmesh
 * @since 2026-09-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskPlanPO {

    /**
     * 会话 ID (主键)
     */
    private String sessionId;

    /**
     * 原始指令
     */
    private String instruction;

    /**
     * 任务列表 (JSONB，PlanTaskPO 数组)
     */
    private String tasks;

    /**
     * 版本号 (乐观锁)
     */
    private Long version;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;
}
