package com.taskmesh.trigger.http;

import com.taskmesh.api.dto.AgentSummaryDTO;
import com.taskmesh.api.response.Response;
import com.taskmesh.domain.worker.service.WorkerRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 已注册 worker 列表 API。
 */
@RestController
@RequestMapping("/api/agents")
public class AgentController {

    private final WorkerRegistry workerRegistry;

    public AgentController(WorkerRegistry workerRegistry) {
        this.workerRegistry = workerRegistry;
    }

    @GetMapping
    public Response<List<AgentSummaryDTO>> listAgents() {
        List<AgentSummaryDTO> agents = workerRegistry.describe().stream()
                .map(descriptor -> {
                    AgentSummaryDTO dto = new AgentSummaryDTO();
                    dto.setAgentType(descriptor.agentType());
                    dto.setDescription(descriptor.description());
                    return dto;
                })
                .collect(Collectors.toList());
        return Response.success(agents);
    }
}
