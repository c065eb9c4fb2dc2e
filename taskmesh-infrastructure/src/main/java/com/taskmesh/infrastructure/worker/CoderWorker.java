package com.taskmesh.infrastructure.worker;

import com.taskmesh.infrastructure.util.JsonCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * coder 示例 worker
 */
@Component
@ConditionalOnProperty(name = "worker.mode", havingValue = "sample", matchIfMissing = true)
public class CoderWorker extends AbstractSampleWorker {

    public CoderWorker(JsonCodec jsonCodec) {
        super(jsonCodec);
    }

    @Override
    public String agentType() {
        return "coder";
    }

    @Override
    public String description() {
        return "Code generation and data processing";
    }

    @Override
    protected String resultType() {
        return "code_execution";
    }

    @Override
    protected Object work(String description) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (containsAny(description, "データ処理", "data processing")) {
            result.put("code", "data = [1, 2, 3, 4, 5]\nprint(sum(data))");
            result.put("output", "15");
        } else if (containsAny(description, "分析", "analy")) {
            result.put("code", "import statistics\nprint(statistics.mean([1, 2, 3, 4, 5]))");
            result.put("output", "3.0");
        } else {
            result.put("code", "# " + description + "\nprint('done')");
            result.put("output", "done");
        }
        result.put("status", "completed");
        return result;
    }
}
