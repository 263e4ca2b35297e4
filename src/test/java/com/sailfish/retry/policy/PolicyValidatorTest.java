package com.sailfish.retry.policy;

import com.sailfish.retry.callback.CallbackRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyValidatorTest {

    @Test
    void validateBackoff_shouldAcceptConstantZeroDelay() {
        assertThatCode(() -> PolicyValidator.validateBackoff(Duration.ZERO, false, null, Jitter.none()))
                .doesNotThrowAnyException();
    }

    @Test
    void validateBackoff_shouldRejectAnyJitter_whenBaseDelayIsZero() {
        assertThatThrownBy(() -> PolicyValidator.validateBackoff(
                Duration.ZERO, false, null, Jitter.of(Duration.ofMillis(1))))
                .isInstanceOf(RetryConfigurationException.class);
    }

    @Test
    void validateBackoff_shouldAcceptJitterEqualToBaseDelay() {
        assertThatCode(() -> PolicyValidator.validateBackoff(
                Duration.ofMillis(50), true, Duration.ofSeconds(1), Jitter.of(Duration.ofMillis(50))))
                .doesNotThrowAnyException();
    }

    @Test
    void validateBackoff_shouldRejectNegativeMaxDelay() {
        assertThatThrownBy(() -> PolicyValidator.validateBackoff(
                Duration.ofMillis(50), true, Duration.ofMillis(-1), Jitter.none()))
                .isInstanceOf(RetryConfigurationException.class);
    }

    @Test
    void validateMaxRetries_shouldAcceptUnlimitedSentinel() {
        assertThatCode(() -> PolicyValidator.validateMaxRetries(RetryPolicy.UNLIMITED_RETRIES))
                .doesNotThrowAnyException();
    }

    @Test
    void requireMode_shouldRejectPolicyOfTheOtherMode() {
        RetryPolicy<Object> asyncPolicy = RetryPolicy.asyncBuilder().build();

        assertThatThrownBy(() -> PolicyValidator.requireMode(asyncPolicy, ExecutionMode.BLOCKING))
                .isInstanceOf(RetryConfigurationException.class)
                .hasMessage("policy is SUSPENDING but the executor is BLOCKING");
    }

    @Test
    void validateMode_shouldAcceptMatchingParts() {
        assertThatCode(() -> PolicyValidator.validateMode(
                ExecutionMode.BLOCKING, ExhaustionAction.fallback(failure -> 1), CallbackRegistry.none()))
                .doesNotThrowAnyException();
    }
}
