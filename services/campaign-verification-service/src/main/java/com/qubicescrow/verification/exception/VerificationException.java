package com.qubicescrow.verification.exception;

import lombok.Getter;

/**
 * Base exception for the campaign verification service
 */
@Getter
public class VerificationException extends RuntimeException {

    private final ErrorCode errorCode;

    public VerificationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public VerificationException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getCode() {
        return errorCode.getCode();
    }
}
