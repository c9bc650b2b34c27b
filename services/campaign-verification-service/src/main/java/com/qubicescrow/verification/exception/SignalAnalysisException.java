package com.qubicescrow.verification.exception;

/**
 * Exception thrown when one of the signal analyzers fails unexpectedly
 */
public class SignalAnalysisException extends VerificationException {

    public SignalAnalysisException(String message, Throwable cause) {
        super(ErrorCode.SIGNAL_ANALYSIS_FAILED, message, cause);
    }
}
