package com.taskmesh.infrastructure.worker;

import com.taskmesh.domain.worker.adapter.gateway.ITaskWorker;
import com.taskmesh.infrastructure.util.JsonCodec;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 示例 worker 基类：不调用外部服务，按任务描述返回结构化 JSON 结果。
 */
public abstract class AbstractSampleWorker implements ITaskWorker {

    private final JsonCodec jsonCodec;

    protected AbstractSampleWorker(JsonCodec jsonCodec) {
        this.jsonCodec = jsonCodec;
    }

    @Override
    public String execute(String description, Map<String, String> injectedContext) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent", getClass().getSimpleName());
        payload.put("task", description);
        payload.put("type", resultType());
        payload.put("result", work(description == null ? "" : description));
        if (injectedContext != null && !injectedContext.isEmpty()) {
            payload.put("dependencies_used", new LinkedHashMap<>(injectedContext));
        }
        payload.put("timestamp", LocalDateTime.now().toString());
        return jsonCodec.writeValue(payload);
    }

    protected abstract String resultType();

    protected abstract Object work(String description);

    protected static boolean containsAny(String text, String... keywords) {
        String lower = text.toLowerCase();
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
