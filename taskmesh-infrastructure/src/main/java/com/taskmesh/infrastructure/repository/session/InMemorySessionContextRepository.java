package com.taskmesh.infrastructure.repository.session;

import com.taskmesh.domain.session.adapter.repository.ISessionContextRepository;
import com.taskmesh.domain.session.model.entity.SessionContextEntity;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 内存会话上下文仓储
 */
@Repository
@ConditionalOnProperty(name = "plan-store.type", havingValue = "memory")
public class InMemorySessionContextRepository implements ISessionContextRepository {

    private final ConcurrentMap<String, SessionContextEntity> contexts = new ConcurrentHashMap<>();

    @Override
    public SessionContextEntity save(SessionContextEntity entity) {
        SessionContextEntity stored = contexts.compute(entity.getSessionId(), (key, current) -> {
            SessionContextEntity next = copy(entity);
            LocalDateTime now = LocalDateTime.now();
            next.setCreatedAt(current == null ? now : current.getCreatedAt());
            next.setUpdatedAt(now);
            return next;
        });
        return copy(stored);
    }

    @Override
    public SessionContextEntity findBySessionId(String sessionId) {
        SessionContextEntity entity = sessionId == null ? null : contexts.get(sessionId);
        return entity == null ? null : copy(entity);
    }

    @Override
    public boolean deleteBySessionId(String sessionId) {
        return sessionId != null && contexts.remove(sessionId) != null;
    }

    private SessionContextEntity copy(SessionContextEntity source) {
        SessionContextEntity target = new SessionContextEntity();
        target.setSessionId(source.getSessionId());
        target.setHearingResult(source.getHearingResult());
        target.setCreatedAt(source.getCreatedAt());
        target.setUpdatedAt(source.getUpdatedAt());
        return target;
    }
}
