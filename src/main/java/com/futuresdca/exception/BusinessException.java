package com.futuresdca.exception;

import java.util.Map;

/**
 * A well-formed request the service refuses, such as a date window whose start is not
 * before its end. Always reported as {@link ErrorCode#VALIDATION_ERROR}.
 */
public class BusinessException extends BaseException {

    public BusinessException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
