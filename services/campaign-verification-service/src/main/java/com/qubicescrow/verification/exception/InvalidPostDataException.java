package com.qubicescrow.verification.exception;

import java.util.List;

/**
 * Exception thrown when required post data is missing or malformed.
 * No partial report is produced for a rejected request.
 */
public class InvalidPostDataException extends VerificationException {

    private final List<String> violations;

    public InvalidPostDataException(List<String> violations) {
        super(ErrorCode.INPUT_VALIDATION_FAILED,
              "Invalid post data: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
