package com.taskmesh.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 会话 hearing 结果 DTO
 */
@Data
public class HearingDTO {

    private String sessionId;
    private String hearingResult;
    private LocalDateTime updatedAt;
}
