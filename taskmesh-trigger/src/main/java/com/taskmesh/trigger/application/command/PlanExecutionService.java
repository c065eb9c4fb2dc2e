package com.taskmesh.trigger.application.command;

import com.taskmesh.domain.plan.adapter.gateway.IPlanGenerator;
import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.domain.plan.model.entity.TaskPlanEntity;
import com.taskmesh.domain.plan.model.valobj.TaskDraftVO;
import com.taskmesh.domain.plan.model.valobj.TaskErrorVO;
import com.taskmesh.domain.plan.model.valobj.TaskPatchVO;
import com.taskmesh.domain.plan.service.PlanDraftDomainService;
import com.taskmesh.domain.plan.service.PlanStoreService;
import com.taskmesh.domain.session.adapter.repository.ISessionContextRepository;
import com.taskmesh.domain.session.model.entity.SessionContextEntity;
import com.taskmesh.domain.task.model.valobj.TaskRetryPolicy;
import com.taskmesh.domain.task.service.DependencyResolverDomainService;
import com.taskmesh.domain.task.service.TaskInputDomainService;
import com.taskmesh.domain.worker.adapter.gateway.ITaskWorker;
import com.taskmesh.domain.worker.service.WorkerRegistry;
import com.taskmesh.trigger.application.common.PlanExecutionProperties;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.enums.TaskStatusEnum;
import com.taskmesh.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Plan executor: resolve dependencies, claim READY tasks, dispatch them to workers in parallel
 * and write results back through the plan store.
 * <p>
 * Re-entrant per session. Claiming is a ready→running transition committed by compare-and-swap,
 * so overlapping callers never dispatch the same task twice.
 * </p>
 */
@Slf4j
@Service
public class PlanExecutionService {

    private final PlanStoreService planStoreService;
    private final PlanDraftDomainService planDraftDomainService;
    private final DependencyResolverDomainService dependencyResolverDomainService;
    private final TaskInputDomainService taskInputDomainService;
    private final WorkerRegistry workerRegistry;
    private final IPlanGenerator planGenerator;
    private final ISessionContextRepository sessionContextRepository;
    private final PlanExecutionProperties properties;
    private final ExecutorService workerPool;
    private final Counter dispatchCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter timeoutCounter;

    public PlanExecutionService(PlanStoreService planStoreService,
                                PlanDraftDomainService planDraftDomainService,
                                DependencyResolverDomainService dependencyResolverDomainService,
                                TaskInputDomainService taskInputDomainService,
                                WorkerRegistry workerRegistry,
                                IPlanGenerator planGenerator,
                                ISessionContextRepository sessionContextRepository,
                                PlanExecutionProperties properties,
                                @Qualifier("taskExecutionWorker") ExecutorService workerPool) {
        this.planStoreService = planStoreService;
        this.planDraftDomainService = planDraftDomainService;
        this.dependencyResolverDomainService = dependencyResolverDomainService;
        this.taskInputDomainService = taskInputDomainService;
        this.workerRegistry = workerRegistry;
        this.planGenerator = planGenerator;
        this.sessionContextRepository = sessionContextRepository;
        this.properties = properties;
        this.workerPool = workerPool;
        this.dispatchCounter = Counter.builder("taskmesh.task.dispatch.total").register(Metrics.globalRegistry);
        this.completedCounter = Counter.builder("taskmesh.task.completed.total").register(Metrics.globalRegistry);
        this.failedCounter = Counter.builder("taskmesh.task.failed.total").register(Metrics.globalRegistry);
        this.timeoutCounter = Counter.builder("taskmesh.task.timeout.total").register(Metrics.globalRegistry);
    }

    /**
     * 由指令生成并保存计划；会话的 hearing 结果作为前置上下文。
     */
    public TaskPlanEntity createPlan(String sessionId, String instruction) {
        if (StringUtils.isBlank(instruction)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Instruction cannot be empty");
        }
        SessionContextEntity context = sessionContextRepository.findBySessionId(sessionId);
        String priorContext = context == null ? null : context.getHearingResult();

        List<TaskDraftVO> drafts;
        try {
            drafts = planGenerator.generate(instruction, priorContext);
        } catch (AppException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new AppException(ResponseCode.GENERATION_ERROR, "Plan generation failed: " + ex.getMessage(), ex);
        }
        if (drafts == null || drafts.isEmpty()) {
            throw new AppException(ResponseCode.GENERATION_ERROR, "Plan generator returned no tasks");
        }
        List<PlanTaskEntity> tasks = planDraftDomainService.toTasks(List.of(), drafts);
        return planStoreService.createPlan(sessionId, instruction, tasks);
    }

    /**
     * 批量模式：执行当前可执行的一切，直到计划稳定或只剩其他调用方在跑的任务。
     */
    public ExecutionResult executeReady(String sessionId) {
        planStoreService.getPlan(sessionId);
        List<CompletableFuture<TaskOutcome>> inFlight = new ArrayList<>();
        ExecutionTally tally = new ExecutionTally();
        while (true) {
            List<CompletableFuture<TaskOutcome>> started = dispatchReadyTasks(sessionId);
            tally.dispatched += started.size();
            inFlight.addAll(started);
            if (inFlight.isEmpty()) {
                Duration wait = nextRetryWait(sessionId);
                if (wait == null || !sleep(wait)) {
                    break;
                }
                continue;
            }
            CompletableFuture.anyOf(inFlight.toArray(new CompletableFuture[0])).join();
            Iterator<CompletableFuture<TaskOutcome>> iterator = inFlight.iterator();
            while (iterator.hasNext()) {
                CompletableFuture<TaskOutcome> future = iterator.next();
                if (future.isDone()) {
                    tally.record(future.join());
                    iterator.remove();
                }
            }
        }
        log.info("Batch execution finished. sessionId={}, dispatched={}, completed={}, failed={}, appended={}",
                sessionId, tally.dispatched, tally.completed, tally.failed, tally.appended);
        return new ExecutionResult(tally.dispatched, tally.completed, tally.failed, tally.appended);
    }

    /**
     * 轮询模式的一次推进：派发后立即返回，结果由回调写回。
     *
     * @return 本次派发的任务数
     */
    public int dispatchReady(String sessionId) {
        return dispatchReadyTasks(sessionId).size();
    }

    private List<CompletableFuture<TaskOutcome>> dispatchReadyTasks(String sessionId) {
        TaskRetryPolicy retryPolicy = properties.toRetryPolicy();
        planStoreService.retryDueTasks(sessionId, retryPolicy);
        planStoreService.applyResolution(sessionId, retryPolicy);
        TaskPlanEntity plan = planStoreService.getPlan(sessionId);

        List<CompletableFuture<TaskOutcome>> futures = new ArrayList<>();
        for (PlanTaskEntity candidate : dependencyResolverDomainService.dispatchOrder(plan.getTasks())) {
            PlanTaskEntity claimed = tryClaim(sessionId, candidate.getId());
            if (claimed == null) {
                continue;
            }
            Map<String, String> injectedContext = taskInputDomainService.buildInjectedContext(plan, claimed);
            futures.add(dispatch(sessionId, claimed, injectedContext));
        }
        return futures;
    }

    private PlanTaskEntity tryClaim(String sessionId, String taskId) {
        try {
            return planStoreService.updateTask(sessionId, taskId,
                    TaskPatchVO.builder().status(TaskStatusEnum.RUNNING).build());
        } catch (AppException ex) {
            log.debug("Skip task claim. sessionId={}, taskId={}, error={}", sessionId, taskId, ex.getMessage());
            return null;
        }
    }

    private CompletableFuture<TaskOutcome> dispatch(String sessionId, PlanTaskEntity task, Map<String, String> injectedContext) {
        dispatchCounter.increment();
        ITaskWorker worker = workerRegistry.find(task.getAgentType()).orElse(null);
        if (worker == null) {
            return CompletableFuture.completedFuture(onFailure(sessionId, task.getId(),
                    TaskErrorVO.workerError("No worker registered for agent type: " + task.getAgentType())));
        }
        log.debug("Task dispatched. sessionId={}, taskId={}, agentType={}", sessionId, task.getId(), task.getAgentType());
        CompletableFuture<String> call;
        try {
            call = CompletableFuture.supplyAsync(() -> worker.execute(task.getDescription(), injectedContext), workerPool);
        } catch (RejectedExecutionException ex) {
            return CompletableFuture.completedFuture(onFailure(sessionId, task.getId(),
                    TaskErrorVO.workerError("Worker pool rejected task: " + ex.getMessage())));
        }
        long timeoutMs = Math.max(properties.getTaskTimeoutMs(), 1L);
        return call.orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((result, ex) -> ex == null
                        ? onSuccess(sessionId, task.getId(), result)
                        : onFailure(sessionId, task.getId(), toTaskError(ex, timeoutMs)));
    }

    private TaskOutcome onSuccess(String sessionId, String taskId, String result) {
        try {
            planStoreService.updateTask(sessionId, taskId,
                    TaskPatchVO.builder().status(TaskStatusEnum.COMPLETED).result(result).build());
            completedCounter.increment();
            log.debug("Task completed. sessionId={}, taskId={}", sessionId, taskId);
        } catch (RuntimeException ex) {
            log.warn("Failed to record task completion. sessionId={}, taskId={}, error={}",
                    sessionId, taskId, ex.getMessage());
            return new TaskOutcome(taskId, null, 0);
        }
        return new TaskOutcome(taskId, TaskStatusEnum.COMPLETED, replan(sessionId, taskId));
    }

    private TaskOutcome onFailure(String sessionId, String taskId, TaskErrorVO error) {
        try {
            planStoreService.updateTask(sessionId, taskId,
                    TaskPatchVO.builder().status(TaskStatusEnum.FAILED).error(error).build());
            failedCounter.increment();
            log.warn("Task failed. sessionId={}, taskId={}, errorKind={}, error={}",
                    sessionId, taskId, error.getKind().getCode(), error.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Failed to record task failure. sessionId={}, taskId={}, error={}",
                    sessionId, taskId, ex.getMessage());
            return new TaskOutcome(taskId, null, 0);
        }
        return new TaskOutcome(taskId, TaskStatusEnum.FAILED, 0);
    }

    private int replan(String sessionId, String taskId) {
        if (!properties.isReplanningEnabled()) {
            return 0;
        }
        try {
            TaskPlanEntity plan = planStoreService.getPlan(sessionId);
            List<TaskDraftVO> drafts = planGenerator.extend(plan, plan.requireTask(taskId));
            if (drafts == null || drafts.isEmpty()) {
                return 0;
            }
            List<PlanTaskEntity> appended = planStoreService.appendDrafts(sessionId, drafts);
            log.info("Plan extended after task completion. sessionId={}, taskId={}, appended={}",
                    sessionId, taskId, appended.size());
            return appended.size();
        } catch (RuntimeException ex) {
            log.warn("Dynamic replanning skipped. sessionId={}, taskId={}, error={}",
                    sessionId, taskId, ex.getMessage());
            return 0;
        }
    }

    private TaskErrorVO toTaskError(Throwable ex, long timeoutMs) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            timeoutCounter.increment();
            return TaskErrorVO.timeout("Worker did not respond within " + timeoutMs + "ms");
        }
        return TaskErrorVO.workerError(StringUtils.defaultIfBlank(cause.getMessage(), cause.getClass().getSimpleName()));
    }

    private Duration nextRetryWait(String sessionId) {
        TaskRetryPolicy retryPolicy = properties.toRetryPolicy();
        TaskPlanEntity plan = planStoreService.getPlan(sessionId);
        LocalDateTime now = LocalDateTime.now();
        Duration wait = null;
        for (PlanTaskEntity task : plan.getTasks()) {
            if (!retryPolicy.isRetryPending(task)) {
                continue;
            }
            Duration remaining = Duration.between(now, retryPolicy.retryDueAt(task));
            if (remaining.isNegative()) {
                remaining = Duration.ZERO;
            }
            if (wait == null || remaining.compareTo(wait) < 0) {
                wait = remaining;
            }
        }
        return wait;
    }

    private boolean sleep(Duration wait) {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(wait.toMillis(), 1L));
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Batch execution interrupted while waiting for retry backoff");
            return false;
        }
    }

    /**
     * 单个任务的执行结果；status 为 null 表示结果未能写回。
     */
    public record TaskOutcome(String taskId, TaskStatusEnum status, int appendedCount) {
    }

    public record ExecutionResult(int dispatchedCount, int completedCount, int failedCount, int appendedCount) {
    }

    private static final class ExecutionTally {

        private int dispatched;
        private int completed;
        private int failed;
        private int appended;

        private void record(TaskOutcome outcome) {
            if (outcome.status() == TaskStatusEnum.COMPLETED) {
                completed++;
            } else if (outcome.status() == TaskStatusEnum.FAILED) {
                failed++;
            }
            appended += outcome.appendedCount();
        }
    }
}
