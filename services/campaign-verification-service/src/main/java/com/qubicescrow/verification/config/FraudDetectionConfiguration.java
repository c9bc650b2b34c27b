package com.qubicescrow.verification.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Fraud detection engine configuration.
 *
 * Validates the bound properties once at startup. Invalid weights or patterns throw
 * from {@link #fraudDetectionConfig(FraudDetectionProperties)}, which stops the
 * application context from starting.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(FraudDetectionProperties.class)
public class FraudDetectionConfiguration {

    @Bean
    public FraudDetectionConfig fraudDetectionConfig(FraudDetectionProperties properties) {
        FraudDetectionConfig config = FraudDetectionConfig.from(properties);

        log.info("Fraud detection configured - weights: {}, pass score: {}, anomaly threshold: {}σ, bot patterns: {}",
                config.getWeights(),
                config.getPassThreshold(),
                config.getVelocityAnomalyThreshold(),
                config.getBotUsernamePatterns().size());

        return config;
    }

    /**
     * Clock used to measure time since posting
     */
    @Bean
    public Clock verificationClock() {
        return Clock.systemUTC();
    }
}
