package com.taskmesh.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 信息参照任务的来源类型
 */
public enum ReferenceTypeEnum {

    KVS_DOCUMENT("kvs_document"),

    WEB_SEARCH("web_search"),

    FILE_READ("file_read");

    private final String code;

    ReferenceTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ReferenceTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ReferenceTypeEnum type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown reference type code: " + code);
    }
}
