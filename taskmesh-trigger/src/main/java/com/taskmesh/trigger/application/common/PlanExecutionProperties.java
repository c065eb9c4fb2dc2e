package com.taskmesh.trigger.application.common;

import com.taskmesh.domain.task.model.valobj.TaskRetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 执行器配置。
 */
@Data
@ConfigurationProperties(prefix = "executor")
public class PlanExecutionProperties {

    /** 单次 worker 调用超时 */
    private long taskTimeoutMs = 60000L;

    /** 任务完成后是否调用计划生成器追加任务 */
    private boolean replanningEnabled = true;

    /** 轮询模式每次处理的会话数 */
    private int pollBatchSize = 50;

    private Retry retry = new Retry();

    @Data
    public static class Retry {

        /** 每个任务最多派发次数，1 表示失败后不自动重试 */
        private int maxAttempts = 1;

        private long baseDelayMs = 1000L;

        private double multiplier = 2.0D;

        private long maxDelayMs = 60000L;
    }

    public TaskRetryPolicy toRetryPolicy() {
        return new TaskRetryPolicy(retry.getMaxAttempts(), retry.getBaseDelayMs(),
                retry.getMultiplier(), retry.getMaxDelayMs());
    }
}
