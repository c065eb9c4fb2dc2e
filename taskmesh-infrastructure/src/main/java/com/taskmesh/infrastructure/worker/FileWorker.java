package com.taskmesh.infrastructure.worker;

import com.taskmesh.infrastructure.util.JsonCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * file 示例 worker
 */
@Component
@ConditionalOnProperty(name = "worker.mode", havingValue = "sample", matchIfMissing = true)
public class FileWorker extends AbstractSampleWorker {

    public FileWorker(JsonCodec jsonCodec) {
        super(jsonCodec);
    }

    @Override
    public String agentType() {
        return "file";
    }

    @Override
    public String description() {
        return "File reading, writing and conversion";
    }

    @Override
    protected String resultType() {
        return "file_operation";
    }

    @Override
    protected Object work(String description) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (containsAny(description, "読み込み", "読み取り", "read")) {
            result.put("operation", "read");
            result.put("files", List.of("sample.txt", "data.json"));
        } else if (containsAny(description, "作成", "書き込み", "write", "create")) {
            result.put("operation", "write");
            result.put("files", List.of("output.txt"));
        } else if (containsAny(description, "変換", "convert")) {
            result.put("operation", "convert");
            result.put("input_files", List.of("input.csv"));
            result.put("output_files", List.of("output.json"));
        } else {
            result.put("operation", "generic");
            result.put("message", "Processed: " + description);
        }
        result.put("status", "completed");
        return result;
    }
}
