package com.condortrader.unit.execution;

import static org.assertj.core.api.Assertions.assertThat;

import com.condortrader.execution.OrderTags;
import com.condortrader.execution.RetryPolicy;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for RetryPolicy backoff and budget, and for order tag derivation. */
class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(500), Duration.ofSeconds(5));

    @Test
    @DisplayName("Backoff doubles per failed attempt")
    void exponentialBackoff() {
        assertThat(policy.backoff(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.backoff(2)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.backoff(3)).isEqualTo(Duration.ofMillis(2000));
    }

    @Test
    @DisplayName("Backoff is capped at the maximum")
    void backoffCapped() {
        assertThat(policy.backoff(5)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.backoff(40)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Three retries means four attempts in total")
    void retryBudget() {
        assertThat(policy.canRetry(3)).isTrue();
        assertThat(policy.canRetry(4)).isFalse();
    }

    @Test
    @DisplayName("Tags replace separators and keep the tail of long ids")
    void orderTags() {
        assertThat(OrderTags.of("NIFTY-240115-1-3")).isEqualTo("NIFTYx240115x1x3");
        assertThat(OrderTags.of("SENSEX-240115-12-105")).isEqualTo("SENSEXx240115x12x105");
        assertThat(OrderTags.of("BANKNIFTY-240115-12-105")).isEqualTo("KNIFTYx240115x12x105");
    }
}
