package com.taskmesh.trigger.http;

import com.taskmesh.api.response.Response;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.EnumSet;
import java.util.Set;

/**
 * 统一 API 异常处理：HTTP 状态恒为 200，引擎错误类型通过 code 区分。
 * <p>
 * 调用方可以自行修正的错误（参数、资源不存在、非法依赖图、非法状态流转、重复计划）记 info；
 * 生成器、worker 与超时类错误记 warn；其余未知异常记 error 并隐藏原始信息。
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_INFO_LENGTH = 300;

    private static final Set<ResponseCode> CALLER_ERRORS = EnumSet.of(
            ResponseCode.ILLEGAL_PARAMETER,
            ResponseCode.NOT_FOUND,
            ResponseCode.DUPLICATE_PLAN,
            ResponseCode.INVALID_GRAPH,
            ResponseCode.INVALID_TRANSITION);

    @ExceptionHandler(AppException.class)
    public Response<Object> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.abbreviate(
                StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo()), MAX_INFO_LENGTH);
        if (CALLER_ERRORS.contains(ex.responseCode())) {
            log.info("HTTP_REJECTED {} errorCode={}, errorMessage={}", describe(request), code, info);
        } else {
            log.warn("HTTP_ERROR {} errorCode={}, errorMessage={}", describe(request), code, info);
        }
        return Response.failure(code, info);
    }

    @ExceptionHandler({
            BindException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public Response<Object> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = StringUtils.abbreviate(
                StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()), MAX_INFO_LENGTH);
        log.info("HTTP_REJECTED {} errorType={}, errorMessage={}", describe(request), ex.getClass().getSimpleName(), info);
        return Response.failure(ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
    }

    @ExceptionHandler(Exception.class)
    public Response<Object> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR {} errorType={}, errorMessage={}",
                describe(request), ex.getClass().getSimpleName(), ex.getMessage(), ex);
        return Response.failure(ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo());
    }

    private String describe(HttpServletRequest request) {
        String method = request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
        String path = request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
        return "method=" + method
                + ", path=" + path
                + ", traceId=" + StringUtils.defaultIfBlank(MDC.get("traceId"), "-")
                + ",";
    }
}
