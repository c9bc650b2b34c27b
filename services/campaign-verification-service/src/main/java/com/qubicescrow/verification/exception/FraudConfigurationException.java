package com.qubicescrow.verification.exception;

import java.util.Locale;

/**
 * Exception thrown when fraud detection configuration is invalid.
 * Raised while the configuration bean is created, so the application fails to start.
 */
public class FraudConfigurationException extends VerificationException {

    private final String configKey;
    private final String actualValue;

    public FraudConfigurationException(ErrorCode errorCode, String message, String configKey, String actualValue) {
        super(errorCode, message);
        this.configKey = configKey;
        this.actualValue = actualValue;
    }

    public FraudConfigurationException(ErrorCode errorCode, String message, String configKey,
                                       String actualValue, Throwable cause) {
        super(errorCode, message, cause);
        this.configKey = configKey;
        this.actualValue = actualValue;
    }

    public String getConfigKey() {
        return configKey;
    }

    public String getActualValue() {
        return actualValue;
    }

    @Override
    public String getMessage() {
        StringBuilder context = new StringBuilder();
        if (configKey != null) context.append("key=").append(configKey);
        if (actualValue != null) context.append(", actual=").append(actualValue);
        if (context.length() == 0) {
            return super.getMessage();
        }
        return super.getMessage() + " [" + context + "]";
    }

    // Static factory methods for common scenarios
    public static FraudConfigurationException invalidWeightSum(double actualSum) {
        return new FraudConfigurationException(
            ErrorCode.CONFIG_INVALID_WEIGHTS,
            String.format(Locale.ROOT, "Weights must sum to 1.0, got %.4f", actualSum),
            "verification.fraud-detection.weights",
            String.valueOf(actualSum)
        );
    }

    public static FraudConfigurationException invalidPattern(String configKey, String pattern, Throwable cause) {
        return new FraudConfigurationException(
            ErrorCode.CONFIG_INVALID_PATTERN,
            "Configured pattern does not compile",
            configKey,
            pattern,
            cause
        );
    }

    public static FraudConfigurationException invalidValue(String configKey, String actualValue, String reason) {
        return new FraudConfigurationException(
            ErrorCode.CONFIG_INVALID_VALUE,
            "Configuration property has invalid value: " + reason,
            configKey,
            actualValue
        );
    }
}
