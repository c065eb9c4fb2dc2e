package com.taskmesh.api.dto;

import lombok.Data;

/**
 * 创建计划请求 DTO
 */
@Data
public class PlanCreateRequestDTO {

    private String instruction;
}
