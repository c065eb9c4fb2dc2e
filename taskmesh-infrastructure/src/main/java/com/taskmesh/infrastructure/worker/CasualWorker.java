package com.taskmesh.infrastructure.worker;

import com.taskmesh.infrastructure.util.JsonCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * casual 示例 worker：文档、报告、摘要
 */
@Component
@ConditionalOnProperty(name = "worker.mode", havingValue = "sample", matchIfMissing = true)
public class CasualWorker extends AbstractSampleWorker {

    public CasualWorker(JsonCodec jsonCodec) {
        super(jsonCodec);
    }

    @Override
    public String agentType() {
        return "casual";
    }

    @Override
    public String description() {
        return "Writing, summarising and general office work";
    }

    @Override
    protected String resultType() {
        return "casual_work";
    }

    @Override
    protected Object work(String description) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (containsAny(description, "レポート", "report")) {
            result.put("content", "# " + description + "\n\n## Overview\nReport prepared.\n\n## Conclusion\nDone.");
            result.put("format", "markdown");
        } else if (containsAny(description, "要約", "summar")) {
            result.put("content", "Summary of " + description + ":\n1. Point 1\n2. Point 2\n3. Point 3");
            result.put("format", "text");
        } else {
            result.put("content", "Processed: " + description);
            result.put("format", "text");
        }
        result.put("status", "completed");
        return result;
    }
}
