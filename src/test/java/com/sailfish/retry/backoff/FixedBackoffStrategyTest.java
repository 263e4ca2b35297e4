package com.sailfish.retry.backoff;

import com.sailfish.retry.policy.Jitter;
import com.sailfish.retry.policy.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class FixedBackoffStrategyTest {

    @Test
    void delayBeforeRetry_shouldBeConstant_withoutJitter() {
        BackoffStrategy strategy = new FixedBackoffStrategy(Duration.ofMillis(500));

        assertThat(strategy.delayBeforeRetry(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(strategy.delayBeforeRetry(7)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void delayBeforeRetry_shouldBeZero_forZeroBaseDelay() {
        BackoffStrategy strategy = new FixedBackoffStrategy(Duration.ZERO);

        assertThat(strategy.delayBeforeRetry(3)).isZero();
    }

    @Test
    void delayBeforeRetry_shouldStayWithinJitterRange() {
        // Given: base 100ms with a (0, 50ms) jitter range
        RetryPolicy<Object> policy = RetryPolicy.builder()
                .baseDelay(Duration.ofMillis(100))
                .jitter(Jitter.between(Duration.ZERO, Duration.ofMillis(50)))
                .build();
        BackoffStrategy strategy = BackoffStrategy.forPolicy(policy, new ThreadLocalRandomSource());

        // Then
        assertThat(strategy).isInstanceOf(FixedBackoffStrategy.class);
        for (int retry = 1; retry <= 1_000; retry++) {
            assertThat(strategy.delayBeforeRetry(retry))
                    .isBetween(Duration.ofMillis(100), Duration.ofMillis(150));
        }
    }

    @Test
    void delayBeforeRetry_shouldReachBothJitterExtremes() {
        Jitter jitter = Jitter.of(Duration.ofMillis(30));

        assertThat(new FixedBackoffStrategy(Duration.ofMillis(30), jitter, (min, max) -> min).delayBeforeRetry(1))
                .isZero();
        assertThat(new FixedBackoffStrategy(Duration.ofMillis(30), jitter, (min, max) -> max).delayBeforeRetry(1))
                .isEqualTo(Duration.ofMillis(60));
    }
}
