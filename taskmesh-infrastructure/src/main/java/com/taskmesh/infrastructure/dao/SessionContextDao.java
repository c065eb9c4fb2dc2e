package com.taskmesh.infrastructure.dao;

import com.taskmesh.infrastructure.dao.po.SessionContextPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 会话上下文 DAO
 */
@Mapper
public interface SessionContextDao {

    /**
     * 插入或覆盖 hearing 结果
     */
    int upsert(SessionContextPO po);

    SessionContextPO selectBySessionId(@Param("sessionId") String sessionId);

    int deleteBySessionId(@Param("sessionId") String sessionId);
}
