package com.taskmesh;

import com.taskmesh.trigger.application.common.PlanExecutionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 任务计划引擎启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到各子模块中的组件。
 * </p>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(PlanExecutionProperties.class)
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
