package com.taskmesh.domain.session.adapter.repository;

import com.taskmesh.domain.session.model.entity.SessionContextEntity;

/**
 * 会话上下文仓储接口
 */
public interface ISessionContextRepository {

    /**
     * 保存（存在则覆盖 hearing 结果）
     */
    SessionContextEntity save(SessionContextEntity entity);

    /**
     * 按会话查询，不存在返回 null
     */
    SessionContextEntity findBySessionId(String sessionId);

    /**
     * 删除
     */
    boolean deleteBySessionId(String sessionId);
}
