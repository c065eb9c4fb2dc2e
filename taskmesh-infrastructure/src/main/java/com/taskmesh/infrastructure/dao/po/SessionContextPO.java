package com.taskmesh.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话上下文 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionContextPO {

    private String sessionId;

    private String hearingResult;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
