package com.bit.governance.exception;

/**
 * 治理层自定义异常：统一封装异常类型与错误信息
 * 抛出该异常时操作未写入任何状态
 */
public class GovernanceException extends RuntimeException {

    // 异常类型（用于分类处理）
    private final ErrorType errorType;

    public GovernanceException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public GovernanceException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public static GovernanceException validation(String message) {
        return new GovernanceException(ErrorType.VALIDATION, message);
    }

    public static GovernanceException unauthorized(String message) {
        return new GovernanceException(ErrorType.AUTHORIZATION, message);
    }

    public static GovernanceException notFound(String message) {
        return new GovernanceException(ErrorType.NOT_FOUND, message);
    }

    public static GovernanceException conflict(String message) {
        return new GovernanceException(ErrorType.STATE_CONFLICT, message);
    }
}
