package com.taskmesh.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskmesh.domain.plan.service.PlanDraftDomainService;
import com.taskmesh.domain.plan.service.PlanProgressDomainService;
import com.taskmesh.domain.plan.service.PlanStoreService;
import com.taskmesh.domain.task.service.DependencyResolverDomainService;
import com.taskmesh.domain.task.service.TaskInputDomainService;
import com.taskmesh.domain.worker.service.WorkerRegistry;
import com.taskmesh.infrastructure.planning.KeywordPlanGenerator;
import com.taskmesh.infrastructure.repository.session.InMemorySessionContextRepository;
import com.taskmesh.infrastructure.util.JsonCodec;
import com.taskmesh.infrastructure.worker.CasualWorker;
import com.taskmesh.infrastructure.worker.WebSearchWorker;
import com.taskmesh.test.support.PlanEngineFixtures;
import com.taskmesh.trigger.application.command.PlanExecutionService;
import com.taskmesh.trigger.application.command.TaskActionCommandService;
import com.taskmesh.trigger.application.common.PlanExecutionProperties;
import com.taskmesh.trigger.application.common.TaskDetailViewAssembler;
import com.taskmesh.trigger.application.query.PlanStatusQueryService;
import com.taskmesh.trigger.http.GlobalApiExceptionHandler;
import com.taskmesh.trigger.http.PlanController;
import com.taskmesh.types.enums.ResponseCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class PlanControllerTest {

    private MockMvc mockMvc;
    private ExecutorService workerPool;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    public void setUp() {
        PlanStoreService planStore = PlanEngineFixtures.planStore();
        JsonCodec jsonCodec = PlanEngineFixtures.jsonCodec();
        WorkerRegistry workerRegistry = new WorkerRegistry();
        workerRegistry.register("web", new WebSearchWorker(jsonCodec));
        workerRegistry.register("casual", new CasualWorker(jsonCodec));
        PlanExecutionProperties properties = new PlanExecutionProperties();
        properties.setTaskTimeoutMs(5000L);
        workerPool = Executors.newFixedThreadPool(4);
        TaskDetailViewAssembler assembler = new TaskDetailViewAssembler();

        PlanExecutionService executionService = new PlanExecutionService(planStore,
                new PlanDraftDomainService(),
                new DependencyResolverDomainService(),
                new TaskInputDomainService(),
                workerRegistry,
                new KeywordPlanGenerator(),
                new InMemorySessionContextRepository(),
                properties,
                workerPool);
        PlanStatusQueryService statusQueryService = new PlanStatusQueryService(planStore,
                new PlanProgressDomainService(), assembler, properties);

        this.mockMvc = MockMvcBuilders.standaloneSetup(new PlanController(executionService, statusQueryService,
                        new TaskActionCommandService(planStore), assembler))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @AfterEach
    public void tearDown() {
        workerPool.shutdownNow();
    }

    @Test
    public void shouldCreateAndExecuteResearchReportPlan() throws Exception {
        createPlan("s-1", "Research the market and write a report")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.version").value(1))
                .andExpect(jsonPath("$.data.tasks[0].taskId").value("info-001"))
                .andExpect(jsonPath("$.data.tasks[0].category").value("info_reference"))
                .andExpect(jsonPath("$.data.tasks[1].taskId").value("task-002"))
                .andExpect(jsonPath("$.data.tasks[1].dependencies[0]").value("info-001"))
                .andExpect(jsonPath("$.data.tasks[1].status").value("pending"));

        mockMvc.perform(post("/api/sessions/s-1/plan/execute"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.dispatchedCount").value(2))
                .andExpect(jsonPath("$.data.completedCount").value(2))
                .andExpect(jsonPath("$.data.failedCount").value(0))
                .andExpect(jsonPath("$.data.status.progress").value("completed"))
                .andExpect(jsonPath("$.data.status.stats.completed").value(2));
    }

    @Test
    public void shouldRejectSecondPlanForSameSession() throws Exception {
        createPlan("s-2", "Book a meeting room");

        createPlan("s-2", "Book a meeting room")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.DUPLICATE_PLAN.getCode()));
    }

    @Test
    public void shouldReturnNotFoundForUnknownSessionStatus() throws Exception {
        mockMvc.perform(get("/api/sessions/missing/plan/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.NOT_FOUND.getCode()));
    }

    @Test
    public void shouldRejectBlankInstructionAsGenerationError() throws Exception {
        createPlan("s-3", " ")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.GENERATION_ERROR.getCode()));
    }

    @Test
    public void shouldMarkTaskObsoleteThroughPatch() throws Exception {
        createPlan("s-4", "Book a meeting room");

        mockMvc.perform(patch("/api/sessions/s-4/plan/tasks/task-001")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("obsolete", true))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.obsolete").value(true))
                .andExpect(jsonPath("$.data.status").value("pending"));
    }

    @Test
    public void shouldRejectUnknownStatusInPatch() throws Exception {
        createPlan("s-5", "Book a meeting room");

        mockMvc.perform(patch("/api/sessions/s-5/plan/tasks/task-001")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("status", "paused"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldRejectIllegalTransitionInPatch() throws Exception {
        createPlan("s-6", "Book a meeting room");

        mockMvc.perform(patch("/api/sessions/s-6/plan/tasks/task-001")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("status", "completed"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.INVALID_TRANSITION.getCode()));
    }

    @Test
    public void shouldRejectRetryOfTaskThatHasNotFailed() throws Exception {
        createPlan("s-7", "Book a meeting room");

        mockMvc.perform(post("/api/sessions/s-7/plan/tasks/task-001/retry"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.INVALID_TRANSITION.getCode()));
    }

    @Test
    public void shouldRetryFailedTaskBackToPending() throws Exception {
        createPlan("s-8", "Book a meeting room");
        mockMvc.perform(patch("/api/sessions/s-8/plan/tasks/task-001")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("status", "ready"))));
        mockMvc.perform(patch("/api/sessions/s-8/plan/tasks/task-001")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("status", "running"))));
        mockMvc.perform(patch("/api/sessions/s-8/plan/tasks/task-001")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "status", "failed",
                                "errorKind", "timeout",
                                "errorMessage", "took too long"))))
                .andExpect(jsonPath("$.data.status").value("failed"))
                .andExpect(jsonPath("$.data.errorKind").value("timeout"));

        mockMvc.perform(post("/api/sessions/s-8/plan/tasks/task-001/retry"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.status").value("pending"))
                .andExpect(jsonPath("$.data.attemptCount").value(0));
    }

    private ResultActions createPlan(String sessionId, String instruction)
            throws Exception {
        return mockMvc.perform(post("/api/sessions/" + sessionId + "/plan")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("instruction", instruction))));
    }
}
