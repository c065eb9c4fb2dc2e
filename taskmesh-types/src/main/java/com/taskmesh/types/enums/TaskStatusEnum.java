package com.taskmesh.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务状态枚举
 * <p>
 * 合法流转：pending→ready, ready→running, running→completed|failed,
 * failed→pending（重试）, pending|ready→blocked, blocked→pending（人工干预）。
 * </p>
 *
 * @author taskmesh
 * @since 2026-09-02
 */
public enum TaskStatusEnum {

    /**
     * 待处理 - 等待前置依赖完成
     */
    PENDING("pending"),

    /**
     * 就绪 - 前置依赖已完成，可以派发
     */
    READY("ready"),

    /**
     * 运行中 - 已派发给 worker，等待结果
     */
    RUNNING("running"),

    /**
     * 已完成 - 终态
     */
    COMPLETED("completed"),

    /**
     * 失败 - worker 报错或超时，除非重试否则为终态
     */
    FAILED("failed"),

    /**
     * 阻塞 - 直接或间接依赖已永久失败
     */
    BLOCKED("blocked");

    private final String code;

    TaskStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean canTransitTo(TaskStatusEnum target) {
        if (target == null) {
            return false;
        }
        switch (this) {
            case PENDING:
                return target == READY || target == BLOCKED;
            case READY:
                return target == RUNNING || target == BLOCKED;
            case RUNNING:
                return target == COMPLETED || target == FAILED;
            case FAILED:
            case BLOCKED:
                return target == PENDING;
            default:
                return false;
        }
    }

    /**
     * 是否仍有推进可能（pending/ready/running）。
     */
    public boolean isUnsettled() {
        return this == PENDING || this == READY || this == RUNNING;
    }

    public static TaskStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskStatusEnum status : TaskStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status code: " + code);
    }
}
