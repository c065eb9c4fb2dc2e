package com.taskmesh.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务级错误类型，记录在失败任务上，不会中断执行循环。
 */
public enum TaskErrorKindEnum {

    WORKER_ERROR("worker_error"),

    TIMEOUT("timeout");

    private final String code;

    TaskErrorKindEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TaskErrorKindEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskErrorKindEnum kind : values()) {
            if (kind.code.equalsIgnoreCase(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown task error kind: " + code);
    }
}
