package com.taskmesh.infrastructure.repository.session;

import com.taskmesh.domain.session.adapter.repository.ISessionContextRepository;
import com.taskmesh.domain.session.model.entity.SessionContextEntity;
import com.taskmesh.infrastructure.dao.SessionContextDao;
import com.taskmesh.infrastructure.dao.po.SessionContextPO;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * 会话上下文仓储实现类（PostgreSQL）
 */
@Repository
@ConditionalOnProperty(name = "plan-store.type", havingValue = "jdbc", matchIfMissing = true)
public class SessionContextRepositoryImpl implements ISessionContextRepository {

    private final SessionContextDao sessionContextDao;

    public SessionContextRepositoryImpl(SessionContextDao sessionContextDao) {
        this.sessionContextDao = sessionContextDao;
    }

    @Override
    public SessionContextEntity save(SessionContextEntity entity) {
        sessionContextDao.upsert(toPO(entity));
        return findBySessionId(entity.getSessionId());
    }

    @Override
    public SessionContextEntity findBySessionId(String sessionId) {
        SessionContextPO po = sessionContextDao.selectBySessionId(sessionId);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public boolean deleteBySessionId(String sessionId) {
        return sessionContextDao.deleteBySessionId(sessionId) > 0;
    }

    private SessionContextPO toPO(SessionContextEntity entity) {
        return SessionContextPO.builder()
                .sessionId(entity.getSessionId())
                .hearingResult(entity.getHearingResult())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private SessionContextEntity toEntity(SessionContextPO po) {
        SessionContextEntity entity = new SessionContextEntity();
        entity.setSessionId(po.getSessionId());
        entity.setHearingResult(po.getHearingResult());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }
}
