package com.qubicescrow.verification.exception;

/**
 * Error codes for the campaign verification service
 * Format: CATEGORY_SPECIFIC_ERROR
 */
public enum ErrorCode {

    // ===== CONFIGURATION ERRORS (CFG_XXX) =====
    CONFIG_INVALID_WEIGHTS("CFG_001", "Signal weights must sum to 1.0"),
    CONFIG_INVALID_PATTERN("CFG_002", "Invalid regular expression in configuration"),
    CONFIG_INVALID_VALUE("CFG_003", "Configuration property has invalid value"),

    // ===== INPUT ERRORS (INPUT_XXX) =====
    INPUT_VALIDATION_FAILED("INPUT_001", "Post data failed validation"),

    // ===== ANALYSIS ERRORS (ANALYSIS_XXX) =====
    SIGNAL_ANALYSIS_FAILED("ANALYSIS_001", "Signal analysis failed");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
