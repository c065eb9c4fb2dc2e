package com.taskmesh.domain.task.model.valobj;

import java.util.List;

/**
 * 一次依赖解析的结果。ready 按 (createdAt, id) 排序。
 *
 * @param ready        本轮可转为 ready 的 pending 任务
 * @param stillPending 仍需等待的 pending 任务
 * @param newlyBlocked 本轮应转为 blocked 的 pending/ready 任务
 */
public record DependencyResolution(List<String> ready, List<String> stillPending, List<String> newlyBlocked) {

    public boolean hasChanges() {
        return !ready.isEmpty() || !newlyBlocked.isEmpty();
    }
}
