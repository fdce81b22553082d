package com.alertrouter.exception;

import java.util.Map;

public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
