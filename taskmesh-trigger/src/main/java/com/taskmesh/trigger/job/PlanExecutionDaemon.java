package com.taskmesh.trigger.job;

import com.taskmesh.domain.plan.service.PlanStoreService;
import com.taskmesh.trigger.application.command.PlanExecutionService;
import com.taskmesh.trigger.application.common.PlanExecutionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Polling daemon: advance every plan that still has unsettled tasks or failed tasks awaiting retry.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "executor.polling-enabled", havingValue = "true")
public class PlanExecutionDaemon {

    private final PlanStoreService planStoreService;
    private final PlanExecutionService planExecutionService;
    private final PlanExecutionProperties properties;

    public PlanExecutionDaemon(PlanStoreService planStoreService,
                               PlanExecutionService planExecutionService,
                               PlanExecutionProperties properties) {
        this.planStoreService = planStoreService;
        this.planExecutionService = planExecutionService;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${executor.poll-interval-ms:1000}")
    public void advancePlans() {
        List<String> sessionIds = planStoreService.findUnsettledSessionIds(
                properties.getPollBatchSize(), properties.toRetryPolicy());
        for (String sessionId : sessionIds) {
            try {
                int dispatched = planExecutionService.dispatchReady(sessionId);
                if (dispatched > 0) {
                    log.debug("Polling tick dispatched tasks. sessionId={}, dispatched={}", sessionId, dispatched);
                }
            } catch (Exception ex) {
                log.warn("Failed to advance plan. sessionId={}, error={}", sessionId, ex.getMessage());
            }
        }
    }
}
