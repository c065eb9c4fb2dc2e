package com.taskmesh.trigger.application.command;

import com.taskmesh.domain.plan.service.PlanStoreService;
import com.taskmesh.domain.session.adapter.repository.ISessionContextRepository;
import com.taskmesh.domain.session.model.entity.SessionContextEntity;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 会话命令服务：创建、删除会话，保存 hearing 结果。
 */
@Slf4j
@Service
public class SessionCommandService {

    private final ISessionContextRepository sessionContextRepository;
    private final PlanStoreService planStoreService;

    public SessionCommandService(ISessionContextRepository sessionContextRepository,
                                 PlanStoreService planStoreService) {
        this.sessionContextRepository = sessionContextRepository;
        this.planStoreService = planStoreService;
    }

    public String createSession() {
        String sessionId = UUID.randomUUID().toString();
        log.info("Session created. sessionId={}", sessionId);
        return sessionId;
    }

    public SessionContextEntity saveHearing(String sessionId, String hearingResult) {
        if (StringUtils.isBlank(sessionId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "SessionId cannot be empty");
        }
        if (StringUtils.isBlank(hearingResult)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Hearing result cannot be empty");
        }
        SessionContextEntity entity = new SessionContextEntity();
        entity.setSessionId(sessionId);
        entity.setHearingResult(hearingResult.trim());
        LocalDateTime now = LocalDateTime.now();
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return sessionContextRepository.save(entity);
    }

    public SessionContextEntity getHearing(String sessionId) {
        SessionContextEntity entity = sessionContextRepository.findBySessionId(sessionId);
        if (entity == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Hearing result not found for session: " + sessionId);
        }
        return entity;
    }

    /**
     * 删除会话的计划和上下文，幂等。
     */
    public void deleteSession(String sessionId) {
        planStoreService.deletePlan(sessionId);
        sessionContextRepository.deleteBySessionId(sessionId);
        log.info("Session data deleted. sessionId={}", sessionId);
    }
}
