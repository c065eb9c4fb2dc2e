package com.taskmesh.test;

import com.taskmesh.infrastructure.util.JsonCodec;
import com.taskmesh.infrastructure.worker.CasualWorker;
import com.taskmesh.infrastructure.worker.CoderWorker;
import com.taskmesh.infrastructure.worker.WebSearchWorker;
import com.taskmesh.test.support.PlanEngineFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

public class SampleTaskWorkerTest {

    private final JsonCodec jsonCodec = PlanEngineFixtures.jsonCodec();

    @Test
    public void shouldEmbedInjectedReferenceResults() {
        String output = new CasualWorker(jsonCodec).execute("Draft the report", Map.of("info-001", "search hits"));

        Map<String, Object> payload = jsonCodec.readMap(output);
        Assertions.assertEquals("casual_work", payload.get("type"));
        Assertions.assertEquals("Draft the report", payload.get("task"));
        Assertions.assertEquals(Map.of("info-001", "search hits"), payload.get("dependencies_used"));
        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) payload.get("result");
        Assertions.assertEquals("markdown", result.get("format"));
    }

    @Test
    public void shouldOmitDependenciesWhenNothingInjected() {
        Map<String, Object> payload = jsonCodec.readMap(new WebSearchWorker(jsonCodec).execute("LLM trends", Map.of()));

        Assertions.assertEquals("web_search", payload.get("type"));
        Assertions.assertFalse(payload.containsKey("dependencies_used"));
        Assertions.assertTrue(payload.get("result") instanceof List<?>);
    }

    @Test
    public void shouldTolerateNullContext() {
        Map<String, Object> payload = jsonCodec.readMap(new CoderWorker(jsonCodec).execute("sales forecast", null));

        Assertions.assertEquals("CoderWorker", payload.get("agent"));
        Assertions.assertNotNull(payload.get("timestamp"));
    }
}
