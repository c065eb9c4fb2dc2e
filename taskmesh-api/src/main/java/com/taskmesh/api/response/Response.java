package com.taskmesh.api.response;

import com.taskmesh.types.enums.ResponseCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应结果。
 * <p>
 * HTTP 状态恒为 200，引擎错误类型（NOT_FOUND、INVALID_GRAPH、INVALID_TRANSITION 等）通过 code 区分，
 * 成功为 "0000"。
 * </p>
 *
 * @param <T> 响应数据的类型
 * @author taskmesh
 * @since 2026-09-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 5129431806731523840L;

    /** 响应码，取值见 ResponseCode */
    private String code;

    /** 响应描述或错误信息 */
    private String info;

    /** 响应数据，失败时为空 */
    private T data;

    public static <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

    public static <T> Response<T> failure(String code, String info) {
        return Response.<T>builder()
                .code(code)
                .info(info)
                .build();
    }
}
