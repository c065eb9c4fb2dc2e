package com.taskmesh.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * worker 线程池配置，前缀 executor.worker。
 */
@Data
@ConfigurationProperties(prefix = "executor.worker", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数，默认8 */
    private Integer coreSize = 8;

    /** 最大线程数，默认16 */
    private Integer maxSize = 16;

    /** 空闲线程存活时间（秒） */
    private Long keepAliveSeconds = 60L;

    /** 队列容量，0 表示直接交接 (SynchronousQueue) */
    private Integer queueCapacity = 256;

    /**
     * 拒绝策略，默认AbortPolicy。
     * <ul>
     *   <li>AbortPolicy：抛出RejectedExecutionException，任务记为 worker_error</li>
     *   <li>CallerRunsPolicy：由派发线程自己执行</li>
     * </ul>
     */
    private String rejectionPolicy = "AbortPolicy";

    private String threadNamePrefix = "task-exec-worker-";

}
