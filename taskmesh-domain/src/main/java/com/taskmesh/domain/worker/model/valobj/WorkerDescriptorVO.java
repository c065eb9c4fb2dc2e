package com.taskmesh.domain.worker.model.valobj;

/**
 * 已注册 worker 的描述
 */
public record WorkerDescriptorVO(String agentType, String description) {
}
