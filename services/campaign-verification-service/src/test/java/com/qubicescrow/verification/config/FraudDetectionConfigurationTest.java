package com.qubicescrow.verification.config;

import com.qubicescrow.verification.exception.FraudConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Binding and startup validation of the fraud detection configuration
 */
@DisplayName("Fraud Detection Configuration Tests")
class FraudDetectionConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(FraudDetectionConfiguration.class, SignalAnalysisExecutorConfiguration.class);

    @Test
    @DisplayName("Should start with default configuration")
    void shouldStartWithDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(FraudDetectionConfig.class);
            assertThat(context.getBean(FraudDetectionConfig.class).getPassThreshold()).isEqualTo(95.0);
        });
    }

    @Test
    @DisplayName("Should bind overridden thresholds and expected regions")
    void shouldBindOverriddenProperties() {
        contextRunner
                .withPropertyValues(
                        "verification.fraud-detection.thresholds.overall-pass-score=90",
                        "verification.fraud-detection.thresholds.velocity-anomaly-max=3.0",
                        "verification.fraud-detection.expected-regions.[Nigeria]=Nigeria,Ghana")
                .run(context -> {
                    FraudDetectionConfig config = context.getBean(FraudDetectionConfig.class);
                    assertThat(config.getPassThreshold()).isEqualTo(90.0);
                    assertThat(config.getVelocityAnomalyThreshold()).isEqualTo(3.0);
                    assertThat(config.expectedRegionsFor("Nigeria")).containsExactly("Nigeria", "Ghana");
                });
    }

    @Test
    @DisplayName("Should fail startup when weights do not sum to one")
    void shouldFailStartupOnInvalidWeights() {
        contextRunner
                .withPropertyValues("verification.fraud-detection.weights.follower-authenticity=0.5")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(FraudConfigurationException.class)
                            .rootCause()
                            .hasMessageContaining("Weights must sum to 1.0");
                });
    }

    @Test
    @DisplayName("Should fail startup on a bot username pattern that does not compile")
    void shouldFailStartupOnInvalidPattern() {
        contextRunner
                .withPropertyValues("verification.fraud-detection.bot-username-patterns[0]=^(user")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("Should size the signal analysis executor from properties")
    void shouldConfigureExecutor() {
        contextRunner
                .withPropertyValues(
                        "verification.fraud-detection.executor.core-pool-size=2",
                        "verification.fraud-detection.executor.max-pool-size=6")
                .run(context -> {
                    ThreadPoolTaskExecutor executor =
                            context.getBean("signalAnalysisExecutor", ThreadPoolTaskExecutor.class);
                    assertThat(executor.getCorePoolSize()).isEqualTo(2);
                    assertThat(executor.getMaxPoolSize()).isEqualTo(6);
                    assertThat(executor.getThreadNamePrefix()).isEqualTo("signal-analysis-");
                });
    }
}
