package com.taskmesh.infrastructure.worker;

import com.taskmesh.infrastructure.util.JsonCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * web 示例 worker：返回固定的搜索结果
 */
@Component
@ConditionalOnProperty(name = "worker.mode", havingValue = "sample", matchIfMissing = true)
public class WebSearchWorker extends AbstractSampleWorker {

    public WebSearchWorker(JsonCodec jsonCodec) {
        super(jsonCodec);
    }

    @Override
    public String agentType() {
        return "web";
    }

    @Override
    public String description() {
        return "Web search and information gathering";
    }

    @Override
    protected String resultType() {
        return "web_search";
    }

    @Override
    protected Object work(String description) {
        return List.of(
                Map.of("title", "Search result 1: " + description,
                        "url", "https://example.com/search1",
                        "snippet", "Summary of result 1"),
                Map.of("title", "Search result 2: " + description,
                        "url", "https://example.com/search2",
                        "snippet", "Summary of result 2"));
    }
}
