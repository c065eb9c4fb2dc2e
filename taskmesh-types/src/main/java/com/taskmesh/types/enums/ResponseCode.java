package com.taskmesh.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 同时作为引擎的错误类型：结构性错误（图、状态流转、重复计划、不存在）在调用处同步拒绝，
 * worker 级错误（WORKER_ERROR、TIMEOUT）只记录在任务上。
 * </p>
 *
 * @author taskmesh
 * @since 2026-09-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 会话、计划或任务不存在 */
    NOT_FOUND("0003", "资源不存在"),

    /** 会话已存在计划 */
    DUPLICATE_PLAN("0004", "计划已存在"),

    /** 依赖成环或引用不存在的任务 */
    INVALID_GRAPH("0005", "非法依赖图"),

    /** 不允许的状态流转 */
    INVALID_TRANSITION("0006", "非法状态流转"),

    /** agent 类型重复注册 */
    DUPLICATE_AGENT_TYPE("0007", "Agent类型重复"),

    /** 计划生成失败 */
    GENERATION_ERROR("0008", "计划生成失败"),

    /** worker 执行失败 */
    WORKER_ERROR("0009", "Worker执行失败"),

    /** 执行超时 */
    TIMEOUT("0010", "执行超时");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

    /**
     * 按响应码查找，未知码返回 null。
     */
    public static ResponseCode fromCode(String code) {
        for (ResponseCode value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        return null;
    }
}
