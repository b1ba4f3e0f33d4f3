package com.bit.restake.exception;

/**
 * 核心层统一异常：携带错误类型，任何失败都不留下部分状态
 */
public class RestakeException extends RuntimeException {

    private final ErrorType errorType;

    public RestakeException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    public RestakeException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public ErrorCategory getCategory() {
        return errorType.getCategory();
    }
}
