package com.example.leads.service.exception;

import org.springframework.http.HttpStatus;

public class ServiceException extends RuntimeException {

    private final HttpStatus status;
    private final ErrorCode errorCode;

    public ServiceException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public ServiceException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause, false, errorCode.status().is5xxServerError());
        this.status = errorCode.status();
        this.errorCode = errorCode;
    }

    public static ServiceException notFound(String message) {
        return new ServiceException(ErrorCode.NOT_FOUND, message);
    }

    public static ServiceException invalidTransition(String message) {
        return new ServiceException(ErrorCode.INVALID_TRANSITION, message);
    }

    public static ServiceException transientStore(String message, Throwable cause) {
        return new ServiceException(ErrorCode.TRANSIENT_STORE_ERROR, message, cause);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean is(ErrorCode code) {
        return errorCode == code;
    }
}
