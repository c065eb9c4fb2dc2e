package com.taskmesh.domain.session.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 会话上下文实体：规划前收集的 hearing 结果，作为计划生成的前置上下文。
 */
@Data
public class SessionContextEntity {

    /**
     * 会话 ID
     */
    private String sessionId;

    /**
     * hearing 结果文本
     */
    private String hearingResult;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;
}
