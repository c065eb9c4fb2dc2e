package com.taskmesh.test.domain;

import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.domain.plan.model.entity.TaskPlanEntity;
import com.taskmesh.domain.plan.model.valobj.TaskErrorVO;
import com.taskmesh.domain.plan.model.valobj.TaskPatchVO;
import com.taskmesh.domain.plan.service.PlanStoreService;
import com.taskmesh.domain.task.model.valobj.DependencyResolution;
import com.taskmesh.domain.task.model.valobj.TaskRetryPolicy;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.enums.TaskStatusEnum;
import com.taskmesh.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.taskmesh.test.support.PlanEngineFixtures.planStore;
import static com.taskmesh.test.support.PlanEngineFixtures.task;

public class PlanStoreServiceTest {

    private static final String SESSION = "session-1";

    private PlanStoreService planStore;

    @BeforeEach
    public void setUp() {
        planStore = planStore();
    }

    @Test
    public void shouldCreatePlanWithAllTasksPending() {
        PlanTaskEntity a = task("A", "web");
        a.setStatus(TaskStatusEnum.COMPLETED);
        planStore.createPlan(SESSION, "write a report", List.of(a, task("B", "casual", "A")));

        TaskPlanEntity plan = planStore.getPlan(SESSION);

        Assertions.assertEquals("write a report", plan.getInstruction());
        Assertions.assertEquals(List.of("A", "B"), ids(plan));
        Assertions.assertTrue(plan.getTasks().stream().allMatch(task -> task.getStatus() == TaskStatusEnum.PENDING));
        Assertions.assertEquals(0L, plan.getVersion());
    }

    @Test
    public void shouldRejectDuplicatePlan() {
        planStore.createPlan(SESSION, List.of(task("A", "web")));

        assertError(ResponseCode.DUPLICATE_PLAN, () -> planStore.createPlan(SESSION, List.of(task("X", "web"))));
        Assertions.assertEquals(List.of("A"), ids(planStore.getPlan(SESSION)));
    }

    @Test
    public void shouldReportMissingPlanAndTask() {
        assertError(ResponseCode.NOT_FOUND, () -> planStore.getPlan("unknown"));

        planStore.createPlan(SESSION, List.of(task("A", "web")));
        assertError(ResponseCode.NOT_FOUND, () -> planStore.updateTask(SESSION, "Z",
                TaskPatchVO.builder().status(TaskStatusEnum.READY).build()));
    }

    @Test
    public void shouldNotStorePlanWithCycle() {
        assertError(ResponseCode.INVALID_GRAPH, () -> planStore.createPlan(SESSION,
                List.of(task("A", "web", "B"), task("B", "web", "A"))));

        assertError(ResponseCode.NOT_FOUND, () -> planStore.getPlan(SESSION));
    }

    @Test
    public void shouldAppendTasksReferencingExistingOnes() {
        planStore.createPlan(SESSION, List.of(task("A", "web")));

        planStore.appendTasks(SESSION, List.of(task("B", "casual", "A"), task("C", "casual", "B")));

        TaskPlanEntity plan = planStore.getPlan(SESSION);
        Assertions.assertEquals(List.of("A", "B", "C"), ids(plan));
        Assertions.assertEquals(1L, plan.getVersion());
    }

    @Test
    public void shouldRejectInvalidAppendWithoutPartialWrite() {
        planStore.createPlan(SESSION, List.of(task("A", "web")));

        assertError(ResponseCode.INVALID_GRAPH, () -> planStore.appendTasks(SESSION,
                List.of(task("B", "casual", "A"), task("A", "coder"))));
        assertError(ResponseCode.INVALID_GRAPH, () -> planStore.appendTasks(SESSION,
                List.of(task("B", "casual", "missing"))));

        TaskPlanEntity plan = planStore.getPlan(SESSION);
        Assertions.assertEquals(List.of("A"), ids(plan));
        Assertions.assertEquals(0L, plan.getVersion());
    }

    @Test
    public void shouldRejectDisallowedTransitionAndKeepState() {
        planStore.createPlan(SESSION, List.of(task("A", "web")));

        assertError(ResponseCode.INVALID_TRANSITION, () -> planStore.updateTask(SESSION, "A",
                TaskPatchVO.builder().status(TaskStatusEnum.COMPLETED).result("x").build()));

        PlanTaskEntity task = planStore.getPlan(SESSION).requireTask("A");
        Assertions.assertEquals(TaskStatusEnum.PENDING, task.getStatus());
        Assertions.assertNull(task.getResult());
    }

    @Test
    public void shouldRejectEmptyPatch() {
        planStore.createPlan(SESSION, List.of(task("A", "web")));

        assertError(ResponseCode.ILLEGAL_PARAMETER, () -> planStore.updateTask(SESSION, "A", TaskPatchVO.builder().build()));
    }

    @Test
    public void shouldAdmitOnlyOneClaimOfReadyTask() {
        planStore.createPlan(SESSION, List.of(task("A", "web")));
        planStore.applyResolution(SESSION, TaskRetryPolicy.noRetry());
        TaskPatchVO claim = TaskPatchVO.builder().status(TaskStatusEnum.RUNNING).build();

        PlanTaskEntity claimed = planStore.updateTask(SESSION, "A", claim);

        Assertions.assertEquals(TaskStatusEnum.RUNNING, claimed.getStatus());
        Assertions.assertEquals(1, claimed.getAttemptCount());
        assertError(ResponseCode.INVALID_TRANSITION, () -> planStore.updateTask(SESSION, "A", claim));
    }

    @Test
    public void shouldBlockDependentsAndUnblockThemOnManualRetry() {
        planStore.createPlan(SESSION, List.of(task("A", "web"), task("B", "casual", "A"), task("C", "casual", "B")));
        runAndFail("A");

        DependencyResolution resolution = planStore.applyResolution(SESSION, TaskRetryPolicy.noRetry());
        Assertions.assertEquals(List.of("B", "C"), resolution.newlyBlocked());

        PlanTaskEntity retried = planStore.updateTask(SESSION, "A",
                TaskPatchVO.builder().status(TaskStatusEnum.PENDING).build());

        Assertions.assertEquals(TaskStatusEnum.PENDING, retried.getStatus());
        Assertions.assertEquals(0, retried.getAttemptCount());
        Assertions.assertNull(retried.getError());
        TaskPlanEntity plan = planStore.getPlan(SESSION);
        Assertions.assertEquals(TaskStatusEnum.PENDING, plan.requireTask("B").getStatus());
        Assertions.assertEquals(TaskStatusEnum.PENDING, plan.requireTask("C").getStatus());

        resolution = planStore.applyResolution(SESSION, TaskRetryPolicy.noRetry());
        Assertions.assertEquals(List.of("A"), resolution.ready());
        Assertions.assertTrue(resolution.newlyBlocked().isEmpty());
    }

    @Test
    public void shouldKeepUnrelatedBlockedTasksBlockedOnManualRetry() {
        planStore.createPlan(SESSION, List.of(
                task("A", "web"), task("B", "casual", "A"),
                task("X", "web"), task("Y", "casual", "X")));
        runAndFail("A");
        planStore.updateTask(SESSION, "X", TaskPatchVO.builder().status(TaskStatusEnum.RUNNING).build());
        planStore.updateTask(SESSION, "X", TaskPatchVO.builder().status(TaskStatusEnum.FAILED).build());
        planStore.applyResolution(SESSION, TaskRetryPolicy.noRetry());

        planStore.updateTask(SESSION, "A", TaskPatchVO.builder().status(TaskStatusEnum.PENDING).build());

        TaskPlanEntity plan = planStore.getPlan(SESSION);
        Assertions.assertEquals(TaskStatusEnum.PENDING, plan.requireTask("B").getStatus());
        Assertions.assertEquals(TaskStatusEnum.BLOCKED, plan.requireTask("Y").getStatus());
        Assertions.assertEquals(TaskStatusEnum.FAILED, plan.requireTask("X").getStatus());
    }

    @Test
    public void shouldOverrideErrorOfFailedTask() {
        planStore.createPlan(SESSION, List.of(task("A", "web")));
        runAndFail("A");
        long version = planStore.getPlan(SESSION).getVersion();

        PlanTaskEntity patched = planStore.updateTask(SESSION, "A",
                TaskPatchVO.builder().error(TaskErrorVO.workerError("operator note")).build());

        Assertions.assertEquals("operator note", patched.getError().getMessage());
        Assertions.assertEquals(TaskStatusEnum.FAILED, patched.getStatus());
        TaskPlanEntity plan = planStore.getPlan(SESSION);
        Assertions.assertEquals("operator note", plan.requireTask("A").getError().getMessage());
        Assertions.assertEquals(version + 1, plan.getVersion());
    }

    @Test
    public void shouldRejectErrorPatchOnTaskThatHasNotFailed() {
        planStore.createPlan(SESSION, List.of(task("A", "web")));

        assertError(ResponseCode.INVALID_TRANSITION, () -> planStore.updateTask(SESSION, "A",
                TaskPatchVO.builder().error(TaskErrorVO.workerError("operator note")).build()));
        assertError(ResponseCode.ILLEGAL_PARAMETER, () -> planStore.updateTask(SESSION, "A",
                TaskPatchVO.builder().status(TaskStatusEnum.READY).error(TaskErrorVO.workerError("x")).build()));

        TaskPlanEntity plan = planStore.getPlan(SESSION);
        Assertions.assertNull(plan.requireTask("A").getError());
        Assertions.assertEquals(TaskStatusEnum.PENDING, plan.requireTask("A").getStatus());
        Assertions.assertEquals(0L, plan.getVersion());
    }

    @Test
    public void shouldNotBumpVersionForPatchThatChangesNothing() {
        planStore.createPlan(SESSION, List.of(task("A", "web")));
        runAndFail("A");
        long version = planStore.getPlan(SESSION).getVersion();

        planStore.updateTask(SESSION, "A", TaskPatchVO.builder().error(TaskErrorVO.workerError("boom")).build());
        planStore.updateTask(SESSION, "A", TaskPatchVO.builder().obsolete(false).build());

        Assertions.assertEquals(version, planStore.getPlan(SESSION).getVersion());
    }

    @Test
    public void shouldListOnlyPlansThatCanStillAdvance() throws Exception {
        planStore.createPlan("stuck", List.of(task("A", "web"), task("B", "casual", "A")));
        planStore.applyResolution("stuck", TaskRetryPolicy.noRetry());
        planStore.updateTask("stuck", "A", TaskPatchVO.builder().status(TaskStatusEnum.RUNNING).build());
        planStore.updateTask("stuck", "A", TaskPatchVO.builder().status(TaskStatusEnum.FAILED).build());
        planStore.applyResolution("stuck", TaskRetryPolicy.noRetry());
        Thread.sleep(5L);
        planStore.createPlan("fresh", List.of(task("X", "web")));

        Assertions.assertEquals(List.of("fresh"), planStore.findUnsettledSessionIds(1, TaskRetryPolicy.noRetry()));
        Assertions.assertEquals(List.of("stuck", "fresh"),
                planStore.findUnsettledSessionIds(10, new TaskRetryPolicy(2, 0L, 1.0D, 0L)));
    }

    @Test
    public void shouldRetryDueFailedTasksKeepingAttemptCount() {
        planStore.createPlan(SESSION, List.of(task("A", "web")));
        runAndFail("A");
        TaskRetryPolicy policy = new TaskRetryPolicy(2, 0L, 2.0D, 0L);

        List<String> retried = planStore.retryDueTasks(SESSION, policy);

        Assertions.assertEquals(List.of("A"), retried);
        PlanTaskEntity task = planStore.getPlan(SESSION).requireTask("A");
        Assertions.assertEquals(TaskStatusEnum.PENDING, task.getStatus());
        Assertions.assertEquals(1, task.getAttemptCount());

        runAndFail("A");
        Assertions.assertTrue(planStore.retryDueTasks(SESSION, policy).isEmpty());
    }

    @Test
    public void shouldBlockDependentOfTaskMarkedObsolete() {
        planStore.createPlan(SESSION, List.of(task("A", "web"), task("B", "casual", "A")));

        planStore.updateTask(SESSION, "A", TaskPatchVO.builder().obsolete(true).build());
        DependencyResolution resolution = planStore.applyResolution(SESSION, TaskRetryPolicy.noRetry());

        Assertions.assertEquals(List.of("B"), resolution.newlyBlocked());
        Assertions.assertTrue(resolution.ready().isEmpty());
        Assertions.assertEquals(TaskStatusEnum.PENDING, planStore.getPlan(SESSION).requireTask("A").getStatus());
    }

    @Test
    public void shouldDeletePlanIdempotently() {
        planStore.createPlan(SESSION, List.of(task("A", "web")));

        planStore.deletePlan(SESSION);
        planStore.deletePlan(SESSION);

        assertError(ResponseCode.NOT_FOUND, () -> planStore.getPlan(SESSION));
    }

    @Test
    public void shouldApplyConcurrentUpdatesWithoutLosingWrites() throws Exception {
        List<PlanTaskEntity> tasks = new ArrayList<>();
        for (int i = 1; i <= 8; i++) {
            tasks.add(task("T" + i, "web"));
        }
        planStore.createPlan(SESSION, tasks);
        planStore.applyResolution(SESSION, TaskRetryPolicy.noRetry());

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PlanTaskEntity>> futures = new ArrayList<>();
        try {
            for (PlanTaskEntity task : tasks) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return planStore.updateTask(SESSION, task.getId(),
                            TaskPatchVO.builder().status(TaskStatusEnum.RUNNING).build());
                }));
            }
            start.countDown();
            for (Future<PlanTaskEntity> future : futures) {
                Assertions.assertEquals(TaskStatusEnum.RUNNING, future.get(10, TimeUnit.SECONDS).getStatus());
            }
        } finally {
            pool.shutdownNow();
        }

        TaskPlanEntity plan = planStore.getPlan(SESSION);
        Assertions.assertTrue(plan.getTasks().stream().allMatch(task -> task.getStatus() == TaskStatusEnum.RUNNING));
        Assertions.assertEquals(9L, plan.getVersion());
    }

    private void runAndFail(String taskId) {
        planStore.applyResolution(SESSION, TaskRetryPolicy.noRetry());
        planStore.updateTask(SESSION, taskId, TaskPatchVO.builder().status(TaskStatusEnum.RUNNING).build());
        planStore.updateTask(SESSION, taskId, TaskPatchVO.builder()
                .status(TaskStatusEnum.FAILED)
                .error(TaskErrorVO.workerError("boom"))
                .build());
    }

    private List<String> ids(TaskPlanEntity plan) {
        return plan.getTasks().stream().map(PlanTaskEntity::getId).collect(Collectors.toList());
    }

    private void assertError(ResponseCode code, Executable executable) {
        AppException ex = Assertions.assertThrows(AppException.class, executable);
        Assertions.assertEquals(code.getCode(), ex.getCode());
    }
}
