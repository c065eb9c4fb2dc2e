package com.taskmesh.trigger.http;

import com.taskmesh.api.dto.HearingDTO;
import com.taskmesh.api.dto.HearingRequestDTO;
import com.taskmesh.api.dto.SessionCreateResponseDTO;
import com.taskmesh.api.response.Response;
import com.taskmesh.domain.session.model.entity.SessionContextEntity;
import com.taskmesh.trigger.application.command.SessionCommandService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 会话 API：创建、删除、hearing 结果。
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionCommandService sessionCommandService;

    public SessionController(SessionCommandService sessionCommandService) {
        this.sessionCommandService = sessionCommandService;
    }

    @PostMapping
    public Response<SessionCreateResponseDTO> createSession() {
        SessionCreateResponseDTO dto = new SessionCreateResponseDTO();
        dto.setSessionId(sessionCommandService.createSession());
        return Response.success(dto);
    }

    @DeleteMapping("/{sessionId}")
    public Response<Boolean> deleteSession(@PathVariable("sessionId") String sessionId) {
        sessionCommandService.deleteSession(sessionId);
        return Response.success(true);
    }

    @PutMapping("/{sessionId}/hearing")
    public Response<HearingDTO> saveHearing(@PathVariable("sessionId") String sessionId,
                                            @RequestBody HearingRequestDTO request) {
        String hearingResult = request == null ? null : request.getHearingResult();
        return Response.success(toDTO(sessionCommandService.saveHearing(sessionId, hearingResult)));
    }

    @GetMapping("/{sessionId}/hearing")
    public Response<HearingDTO> getHearing(@PathVariable("sessionId") String sessionId) {
        return Response.success(toDTO(sessionCommandService.getHearing(sessionId)));
    }

    private HearingDTO toDTO(SessionContextEntity entity) {
        HearingDTO dto = new HearingDTO();
        dto.setSessionId(entity.getSessionId());
        dto.setHearingResult(entity.getHearingResult());
        dto.setUpdatedAt(entity.getUpdatedAt());
        return dto;
    }
}
