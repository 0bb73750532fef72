package com.liveprecision.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 0.2, 5);
        for (int i = 0; i < 20; i++) {
            assertThat(policy.delayMs(0)).isBetween(800L, 1200L);
        }
    }

    @Test
    void delayMs_doublesPerAttempt() {
        RetryPolicy policy = new RetryPolicy(1000L, 0, 3);
        assertThat(policy.delayMs(1)).isEqualTo(2000L);
        assertThat(policy.delayMs(2)).isEqualTo(4000L);
        assertThat(policy.delayMs(3)).isEqualTo(8000L);
    }

    @Test
    void delayMs_capsShiftForHugeAttempts() {
        RetryPolicy policy = new RetryPolicy(1L, 0, 3);
        assertThat(policy.delayMs(64)).isEqualTo(1L << 20);
    }

    @Test
    void isExhausted_afterMaxAttempts() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();
        assertThat(policy.isExhausted(2)).isFalse();
        assertThat(policy.isExhausted(3)).isTrue();
    }

    @Test
    void rejectsNegativeArguments() {
        assertThatThrownBy(() -> new RetryPolicy(-1, 0, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, 0, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
