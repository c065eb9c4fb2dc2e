package com.taskmesh.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务类别枚举：可执行任务 / 信息参照任务。
 * 信息参照任务的结果会原样注入到依赖它的任务输入中。
 */
public enum TaskCategoryEnum {

    ACTION("action"),

    INFO_REFERENCE("info_reference");

    private final String code;

    TaskCategoryEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String idPrefix() {
        return this == INFO_REFERENCE ? "info" : "task";
    }

    public static TaskCategoryEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskCategoryEnum category : values()) {
            if (category.code.equalsIgnoreCase(code)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown task category code: " + code);
    }
}
