package org.tanzu.pvemcp.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayGrowsLinearlyWithTheRetryNumber() {
        RetryPolicy policy = RetryPolicy.linear(3, Duration.ofMillis(500));

        assertThat(policy.delayBefore(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.delayBefore(3)).isEqualTo(Duration.ofMillis(1500));
        assertThat(policy.delayBefore(0)).isEqualTo(Duration.ZERO);
    }

    @Test
    void negativeBudgetIsRejected() {
        assertThatThrownBy(() -> new RetryPolicy(-1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withMaxRetriesKeepsTheDelay() {
        RetryPolicy policy = RetryPolicy.linear(3, Duration.ofSeconds(1));

        assertThat(policy.withMaxRetries(3)).isSameAs(policy);
        assertThat(policy.withMaxRetries(0).getBaseDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(RetryPolicy.NONE.getMaxRetries()).isZero();
    }
}
