package com.taskmesh.infrastructure.planning;

import com.taskmesh.domain.plan.adapter.gateway.IPlanGenerator;
import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.domain.plan.model.entity.TaskPlanEntity;
import com.taskmesh.domain.plan.model.valobj.TaskDraftVO;
import com.taskmesh.infrastructure.util.JsonCodec;
import com.taskmesh.types.enums.ReferenceTypeEnum;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.enums.TaskCategoryEnum;
import com.taskmesh.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 基于 ChatClient 的计划生成器：要求模型只返回 {"tasks": [...]} JSON。
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "planner.mode", havingValue = "llm")
public class ChatClientPlanGenerator implements IPlanGenerator {

    private final ChatClient chatClient;
    private final JsonCodec jsonCodec;
    private final boolean replanEnabled;

    public ChatClientPlanGenerator(ChatClient.Builder chatClientBuilder,
                                   JsonCodec jsonCodec,
                                   @Value("${planner.llm.replan-enabled:false}") boolean replanEnabled) {
        this.chatClient = chatClientBuilder.build();
        this.jsonCodec = jsonCodec;
        this.replanEnabled = replanEnabled;
    }

    @Override
    public List<TaskDraftVO> generate(String instruction, String priorContext) {
        if (StringUtils.isBlank(instruction)) {
            throw new AppException(ResponseCode.GENERATION_ERROR, "Instruction is empty, cannot generate plan");
        }
        StringBuilder prompt = new StringBuilder(basePrompt());
        prompt.append("\nUser instruction: ").append(instruction.trim());
        if (StringUtils.isNotBlank(priorContext)) {
            prompt.append("\nHearing result: ").append(priorContext.trim());
        }
        List<TaskDraftVO> drafts = toDrafts(parsePayload(call(prompt.toString())));
        if (drafts.isEmpty()) {
            throw new AppException(ResponseCode.GENERATION_ERROR, "Planner returned no tasks");
        }
        log.info("Model plan generated. taskCount={}, instruction={}", drafts.size(), StringUtils.abbreviate(instruction, 80));
        return drafts;
    }

    @Override
    public List<TaskDraftVO> extend(TaskPlanEntity plan, PlanTaskEntity completedTask) {
        if (!replanEnabled) {
            return List.of();
        }
        StringBuilder prompt = new StringBuilder(basePrompt());
        prompt.append("\nA task of an existing plan has completed. Return only the ADDITIONAL tasks still needed,")
                .append(" or {\"tasks\": []} when the plan is sufficient.")
                .append(" Dependencies may reference existing task ids.");
        prompt.append("\nOriginal instruction: ").append(StringUtils.defaultString(plan.getInstruction()));
        prompt.append("\nExisting tasks: ");
        for (PlanTaskEntity task : plan.getTasks()) {
            prompt.append("\n- ").append(task.getId()).append(" [").append(task.getStatus().getCode()).append("] ")
                    .append(task.getDescription());
        }
        prompt.append("\nCompleted task ").append(completedTask.getId()).append(" result: ")
                .append(StringUtils.abbreviate(StringUtils.defaultString(completedTask.getResult()), 2000));
        List<TaskDraftVO> drafts = toDrafts(parsePayload(call(prompt.toString())));
        log.debug("Model replanning returned drafts. sessionId={}, taskId={}, count={}",
                plan.getSessionId(), completedTask.getId(), drafts.size());
        return drafts;
    }

    private String basePrompt() {
        return "You are a task planner. Decompose the request into a small DAG of tasks and return JSON only: "
                + "{\"tasks\": [{\"ref\": \"...\", \"agent_type\": \"web|coder|casual|file\", \"description\": \"...\", "
                + "\"dependencies\": [\"ref\"], \"category\": \"action|info_reference\", "
                + "\"reference_type\": \"web_search|file_read|kvs_document\", \"tags\": [\"...\"]}]}. "
                + "Dependencies must reference refs of other tasks and must not form cycles.";
    }

    private String call(String prompt) {
        try {
            ChatClient.CallResponseSpec response = chatClient.prompt(prompt).call();
            return response == null ? null : response.content();
        } catch (RuntimeException ex) {
            throw new AppException(ResponseCode.GENERATION_ERROR, "Planner model call failed: " + ex.getMessage(), ex);
        }
    }

    private Map<String, Object> parsePayload(String content) {
        if (StringUtils.isBlank(content)) {
            throw new AppException(ResponseCode.GENERATION_ERROR, "Planner returned empty content");
        }
        Map<String, Object> payload = jsonCodec.readEmbeddedObject(content);
        if (payload == null) {
            throw new AppException(ResponseCode.GENERATION_ERROR, "Planner result is not valid JSON");
        }
        return payload;
    }

    @SuppressWarnings("unchecked")
    private List<TaskDraftVO> toDrafts(Map<String, Object> payload) {
        Object tasks = payload.get("tasks");
        if (!(tasks instanceof List<?> rawTasks)) {
            return Collections.emptyList();
        }
        List<TaskDraftVO> drafts = new ArrayList<>();
        for (Object raw : rawTasks) {
            if (!(raw instanceof Map<?, ?>)) {
                continue;
            }
            Map<String, Object> item = (Map<String, Object>) raw;
            try {
                String category = getString(item, "category");
                String referenceType = getString(item, "reference_type", "referenceType");
                drafts.add(TaskDraftVO.builder()
                        .ref(getString(item, "ref", "id"))
                        .agentType(StringUtils.defaultIfBlank(getString(item, "agent_type", "agentType", "agent"), "casual"))
                        .description(getString(item, "description", "task"))
                        .dependencies(getStringList(item, "dependencies", "need"))
                        .category(category == null ? TaskCategoryEnum.ACTION : TaskCategoryEnum.fromCode(category))
                        .referenceType(referenceType == null ? null : ReferenceTypeEnum.fromCode(referenceType))
                        .tags(getStringList(item, "tags"))
                        .build());
            } catch (IllegalArgumentException ex) {
                throw new AppException(ResponseCode.GENERATION_ERROR, "Planner returned invalid task: " + ex.getMessage(), ex);
            }
        }
        return drafts;
    }

    private String getString(Map<String, Object> source, String... keys) {
        for (String key : keys) {
            Object value = source.get(key);
            if (value != null && StringUtils.isNotBlank(String.valueOf(value))) {
                return String.valueOf(value).trim();
            }
        }
        return null;
    }

    private List<String> getStringList(Map<String, Object> source, String... keys) {
        List<String> values = new ArrayList<>();
        for (String key : keys) {
            Object value = source.get(key);
            if (value instanceof List<?> list) {
                list.stream().filter(item -> item != null).forEach(item -> values.add(String.valueOf(item)));
                return values;
            }
        }
        return values;
    }
}
