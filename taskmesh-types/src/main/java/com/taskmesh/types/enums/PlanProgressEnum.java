package com.taskmesh.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 计划整体进度
 *
 * @author taskmesh
 * @since 2026-09-02
 */
public enum PlanProgressEnum {

    /**
     * 仍有 pending/ready/running 任务
     */
    IN_PROGRESS("in_progress"),

    /**
     * 全部任务已完成
     */
    COMPLETED("completed"),

    /**
     * 无可推进任务，但存在 failed 或 blocked 任务
     */
    STUCK("stuck");

    private final String code;

    PlanProgressEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
