package com.taskmesh.domain.worker.adapter.gateway;

import java.util.Map;

/**
 * Worker 能力接口：按 agentType 注册，执行单个任务。
 * <p>
 * 实现必须可以被不同任务并发调用；失败时直接抛出异常，由执行器记录为 WORKER_ERROR。
 * </p>
 *
 * @author taskmesh
 * @since 2026-09-02
 */
public interface ITaskWorker {

    /**
     * 注册使用的 agent 类型标签，例如 web / coder / casual / file
     */
    String agentType();

    /**
     * 展示用描述
     */
    default String description() {
        return agentType();
    }

    /**
     * 执行任务
     *
     * @param description     任务描述
     * @param injectedContext 信息参照依赖的结果，key 为依赖任务 id
     * @return 任务结果
     */
    String execute(String description, Map<String, String> injectedContext);
}
