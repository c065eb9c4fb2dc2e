package com.taskmesh.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 线程池配置类。
 * <p>
 * taskExecutionWorker 承载 worker 调用，与调度线程解耦，避免 @Scheduled 线程被长调用阻塞。
 * </p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "taskExecutionWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "taskExecutionWorker")
    public ThreadPoolExecutor taskExecutionWorker(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCoreSize(), 1);
        int maxSize = Math.max(properties.getMaxSize(), coreSize);
        int queueCapacity = Math.max(properties.getQueueCapacity(), 0);
        BlockingQueue<Runnable> queue = queueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(queueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                coreSize,
                maxSize,
                Math.max(properties.getKeepAliveSeconds(), 0L),
                TimeUnit.SECONDS,
                queue,
                new ThreadFactoryBuilder()
                        .setNameFormat(properties.getThreadNamePrefix() + "%d")
                        .setDaemon(false)
                        .build(),
                buildRejectedExecutionHandler(properties.getRejectionPolicy()));
        log.info("Task execution worker pool created. coreSize={}, maxSize={}, queueCapacity={}",
                coreSize, maxSize, queueCapacity);
        return executor;
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
