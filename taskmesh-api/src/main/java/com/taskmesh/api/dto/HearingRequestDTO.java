package com.taskmesh.api.dto;

import lombok.Data;

/**
 * 保存会话 hearing 结果请求 DTO
 */
@Data
public class HearingRequestDTO {

    private String hearingResult;
}
