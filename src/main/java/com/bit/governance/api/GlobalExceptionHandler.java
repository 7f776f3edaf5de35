package com.bit.governance.api;

import com.bit.governance.exception.ErrorType;
import com.bit.governance.exception.GovernanceException;
import com.bit.governance.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 异常统一转换为 Result
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(GovernanceException.class)
    public Result<Void> handleGovernance(GovernanceException e) {
        if (e.getErrorType() == ErrorType.STORAGE_FAILED) {
            log.error("存储失败", e);
        } else {
            log.warn("请求被拒绝 {}: {}", e.getErrorType(), e.getMessage());
        }
        return Result.error(e.getErrorType().getCode(), e.getMessage());
    }

    //地址/ID 格式错误
    @ExceptionHandler(IllegalArgumentException.class)
    public Result<Void> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("参数错误: {}", e.getMessage());
        return Result.error(ErrorType.VALIDATION.getCode(), e.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public Result<Void> handleMissingHeader(MissingRequestHeaderException e) {
        return Result.error(ErrorType.VALIDATION.getCode(), "缺少请求头 " + e.getHeaderName());
    }
}
