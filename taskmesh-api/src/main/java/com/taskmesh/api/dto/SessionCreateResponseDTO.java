package com.taskmesh.api.dto;

import lombok.Data;

/**
 * 创建会话响应 DTO
 */
@Data
public class SessionCreateResponseDTO {

    private String sessionId;
}
