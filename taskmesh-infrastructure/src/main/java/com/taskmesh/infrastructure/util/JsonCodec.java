package com.taskmesh.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 计划记录与模型输出共用的 JSON 编解码。
 * <p>
 * 严格方法（read/write）失败抛 UN_ERROR；{@link #readEmbeddedObject(String)} 面向模型输出，
 * 允许 JSON 前后夹带说明文字，解析不出时返回 null。
 * </p>
 *
 * @author taskmesh
 * @since 2026-09-02
 */
@Slf4j
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> readMap(String json) {
        return readValue(json, MAP_REF);
    }

    public <T> T readValue(String json, TypeReference<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Invalid json payload: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * 先整体解析，失败再取第一个 '{' 到最后一个 '}' 之间的内容。
     */
    public Map<String, Object> readEmbeddedObject(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        Map<String, Object> value = tryReadMap(text.trim());
        if (value != null) {
            return value;
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        return start >= 0 && end > start ? tryReadMap(text.substring(start, end + 1)) : null;
    }

    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to serialize " + value.getClass().getSimpleName(), ex);
        }
    }

    private Map<String, Object> tryReadMap(String candidate) {
        try {
            return objectMapper.readValue(candidate, MAP_REF);
        } catch (JsonProcessingException ex) {
            log.debug("Not a json object: {}", ex.getOriginalMessage());
            return null;
        }
    }
}
