package com.bit.restake.api;

import com.bit.restake.exception.ErrorCategory;
import com.bit.restake.exception.RestakeException;
import com.bit.restake.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 业务异常统一转成 Result，权限错误 510，其余 500
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(RestakeException.class)
    public Result<Void> handleRestake(RestakeException e) {
        Result<Void> result = e.getCategory() == ErrorCategory.AUTHORIZATION
                ? Result.noauth(e.getMessage())
                : Result.error(e.getMessage());
        result.setErrorType(e.getErrorType().name());
        log.debug("request rejected {}: {}", e.getErrorType(), e.getMessage());
        return result;
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class})
    public Result<Void> handleBadInput(Exception e) {
        log.debug("bad request: {}", e.getMessage());
        return Result.error(e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public Result<Void> handleIllegalState(IllegalStateException e) {
        log.warn("request failed: {}", e.getMessage());
        return Result.error(e.getMessage());
    }
}
