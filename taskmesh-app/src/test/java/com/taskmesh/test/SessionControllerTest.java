package com.taskmesh.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskmesh.domain.plan.service.PlanStoreService;
import com.taskmesh.infrastructure.repository.session.InMemorySessionContextRepository;
import com.taskmesh.test.support.PlanEngineFixtures;
import com.taskmesh.trigger.application.command.SessionCommandService;
import com.taskmesh.trigger.http.GlobalApiExceptionHandler;
import com.taskmesh.trigger.http.SessionController;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static com.taskmesh.test.support.PlanEngineFixtures.task;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class SessionControllerTest {

    private MockMvc mockMvc;
    private PlanStoreService planStore;
    private InMemorySessionContextRepository sessionContextRepository;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    public void setUp() {
        planStore = PlanEngineFixtures.planStore();
        sessionContextRepository = new InMemorySessionContextRepository();
        this.mockMvc = MockMvcBuilders.standaloneSetup(
                        new SessionController(new SessionCommandService(sessionContextRepository, planStore)))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldCreateSession() throws Exception {
        mockMvc.perform(post("/api/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.sessionId").isNotEmpty());
    }

    @Test
    public void shouldSaveAndReadHearingResult() throws Exception {
        mockMvc.perform(put("/api/sessions/s-1/hearing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("hearingResult", "  budget is tight  "))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.hearingResult").value("budget is tight"));

        mockMvc.perform(get("/api/sessions/s-1/hearing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sessionId").value("s-1"))
                .andExpect(jsonPath("$.data.hearingResult").value("budget is tight"));
    }

    @Test
    public void shouldRejectBlankHearingResult() throws Exception {
        mockMvc.perform(put("/api/sessions/s-1/hearing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("hearingResult", ""))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @Test
    public void shouldReturnNotFoundForMissingHearing() throws Exception {
        mockMvc.perform(get("/api/sessions/unknown/hearing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.NOT_FOUND.getCode()));
    }

    @Test
    public void shouldDeletePlanAndContextIdempotently() throws Exception {
        planStore.createPlan("s-2", List.of(task("A", "casual")));
        mockMvc.perform(put("/api/sessions/s-2/hearing")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("hearingResult", "context"))));

        mockMvc.perform(delete("/api/sessions/s-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(true));
        mockMvc.perform(delete("/api/sessions/s-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()));

        Assertions.assertNull(sessionContextRepository.findBySessionId("s-2"));
        AppException ex = Assertions.assertThrows(AppException.class, () -> planStore.getPlan("s-2"));
        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
    }
}
