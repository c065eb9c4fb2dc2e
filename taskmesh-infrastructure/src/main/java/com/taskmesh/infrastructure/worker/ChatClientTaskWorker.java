package com.taskmesh.infrastructure.worker;

import com.taskmesh.domain.worker.adapter.gateway.ITaskWorker;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;

import java.util.Map;

/**
 * 基于 ChatClient 的 worker，每个 agentType 一个实例，系统提示词区分角色。
 */
public class ChatClientTaskWorker implements ITaskWorker {

    private final String agentType;
    private final String description;
    private final ChatClient chatClient;

    public ChatClientTaskWorker(String agentType, String description, String systemPrompt, ChatClient.Builder builder) {
        this.agentType = agentType;
        this.description = description;
        this.chatClient = builder.defaultSystem(systemPrompt).build();
    }

    @Override
    public String agentType() {
        return agentType;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public String execute(String taskDescription, Map<String, String> injectedContext) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Task: ").append(StringUtils.defaultString(taskDescription));
        if (injectedContext != null && !injectedContext.isEmpty()) {
            prompt.append("\nReference material:");
            injectedContext.forEach((taskId, result) ->
                    prompt.append("\n[").append(taskId).append("]\n").append(result));
        }
        ChatClient.CallResponseSpec response = chatClient.prompt(prompt.toString()).call();
        String content = response == null ? null : response.content();
        if (StringUtils.isBlank(content)) {
            throw new AppException(ResponseCode.WORKER_ERROR, "Model returned empty content for agent " + agentType);
        }
        return content;
    }
}
