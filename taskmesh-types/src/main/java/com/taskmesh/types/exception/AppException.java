package com.taskmesh.types.exception;

import com.taskmesh.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 所有业务异常通过此类抛出，code 取自 {@link ResponseCode}，便于上层统一捕获和处理。
 * </p>
 *
 * @author taskmesh
 * @since 2026-09-02
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 2406913874152032217L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    public AppException(ResponseCode responseCode, String message) {
        this(responseCode.getCode(), message);
    }

    public AppException(ResponseCode responseCode, String message, Throwable cause) {
        this(responseCode.getCode(), message, cause);
    }

    /**
     * 判断异常是否属于指定的引擎错误类型。
     */
    public boolean is(ResponseCode responseCode) {
        return responseCode != null && responseCode == responseCode();
    }

    /**
     * 对应的引擎错误类型，自定义码返回 null。
     */
    public ResponseCode responseCode() {
        return ResponseCode.fromCode(code);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
