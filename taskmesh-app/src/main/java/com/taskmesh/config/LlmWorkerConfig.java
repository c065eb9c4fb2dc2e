package com.taskmesh.config;

import com.taskmesh.domain.worker.adapter.gateway.ITaskWorker;
import com.taskmesh.infrastructure.worker.ChatClientTaskWorker;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * worker.mode=llm 时的内置 worker；ChatClient.Builder 为原型作用域，每个 worker 单独取一个。
 */
@Configuration
@ConditionalOnProperty(name = "worker.mode", havingValue = "llm")
public class LlmWorkerConfig {

    @Bean
    public ITaskWorker webLlmWorker(ObjectProvider<ChatClient.Builder> builders) {
        return new ChatClientTaskWorker("web", "Web research and information gathering",
                "You are a research assistant. Collect and summarise the information the task asks for.",
                builders.getObject());
    }

    @Bean
    public ITaskWorker coderLlmWorker(ObjectProvider<ChatClient.Builder> builders) {
        return new ChatClientTaskWorker("coder", "Code, data processing and analysis",
                "You are a software engineer. Produce working code or analysis for the task.",
                builders.getObject());
    }

    @Bean
    public ITaskWorker casualLlmWorker(ObjectProvider<ChatClient.Builder> builders) {
        return new ChatClientTaskWorker("casual", "General writing and everyday tasks",
                "You are a helpful assistant. Complete the task using the reference material when given.",
                builders.getObject());
    }

    @Bean
    public ITaskWorker fileLlmWorker(ObjectProvider<ChatClient.Builder> builders) {
        return new ChatClientTaskWorker("file", "File reading and document handling",
                "You are a document assistant. Extract and organise the content the task refers to.",
                builders.getObject());
    }
}
