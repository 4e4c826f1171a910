package com.condortrader.unit.feed;

import static org.assertj.core.api.Assertions.assertThat;

import com.condortrader.domain.enums.FeedState;
import com.condortrader.domain.model.FeedStatus;
import com.condortrader.feed.FeedHealth;
import com.condortrader.feed.ReconnectPolicy;
import java.time.Duration;
import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for FeedHealth staleness and the ReconnectPolicy schedule. */
class FeedHealthTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 15, 10, 0);
    private static final Duration THRESHOLD = Duration.ofSeconds(5);

    @Nested
    @DisplayName("Feed Health")
    class Health {

        @Test
        @DisplayName("Connected feed with a recent message is healthy")
        void healthy() {
            FeedHealth health = new FeedHealth(FeedState.CONNECTED);
            health.recordMessage(T0);

            FeedStatus status = health.status(T0.plusSeconds(5), THRESHOLD);

            assertThat(status.isStale()).isFalse();
            assertThat(status.getState()).isEqualTo(FeedState.CONNECTED);
        }

        @Test
        @DisplayName("Silence beyond the threshold is stale")
        void silenceIsStale() {
            FeedHealth health = new FeedHealth(FeedState.CONNECTED);
            health.recordMessage(T0);

            assertThat(health.status(T0.plusSeconds(6), THRESHOLD).isStale()).isTrue();
        }

        @Test
        @DisplayName("No message yet is stale")
        void noMessageIsStale() {
            assertThat(new FeedHealth(FeedState.CONNECTED).status(T0, THRESHOLD).isStale()).isTrue();
        }

        @Test
        @DisplayName("Reconnecting is stale even with a recent message")
        void reconnectingIsStale() {
            FeedHealth health = new FeedHealth(FeedState.CONNECTED);
            health.recordMessage(T0);
            health.transition(FeedState.RECONNECTING);

            assertThat(health.status(T0, THRESHOLD).isStale()).isTrue();
        }

        @Test
        @DisplayName("Older message times never move the last message back")
        void lastMessageMonotonic() {
            FeedHealth health = new FeedHealth(FeedState.CONNECTED);
            health.recordMessage(T0);
            health.recordMessage(T0.minusSeconds(30));

            assertThat(health.getLastMessageAt()).isEqualTo(T0);
        }

        @Test
        @DisplayName("A closed handle stays closed")
        void closedIsFinal() {
            FeedHealth health = new FeedHealth(FeedState.CONNECTED);
            health.close();
            health.transition(FeedState.CONNECTED);

            assertThat(health.isConnected()).isFalse();
            assertThat(health.status(T0, THRESHOLD).getState()).isEqualTo(FeedState.CLOSED);
        }
    }

    @Nested
    @DisplayName("Reconnect Policy")
    class Reconnect {

        @Test
        @DisplayName("Attempts back off exponentially up to the maximum")
        void backoff() {
            ReconnectPolicy policy = new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(10), 10);

            assertThat(policy.backoff(1)).isEqualTo(Duration.ofSeconds(1));
            assertThat(policy.backoff(3)).isEqualTo(Duration.ofSeconds(4));
            assertThat(policy.backoff(5)).isEqualTo(Duration.ofSeconds(10));
        }

        @Test
        @DisplayName("Scheduled attempt becomes due after its backoff")
        void dueAfterBackoff() {
            ReconnectPolicy policy = new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(10), 3);

            assertThat(policy.scheduleNext(T0)).isTrue();
            assertThat(policy.isDue(T0)).isFalse();
            assertThat(policy.isDue(T0.plusSeconds(1))).isTrue();

            policy.attemptStarted();
            assertThat(policy.isDue(T0.plusSeconds(2))).isFalse();
        }

        @Test
        @DisplayName("Budget runs out after maxAttempts failures")
        void exhausted() {
            ReconnectPolicy policy = new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(10), 2);

            assertThat(policy.scheduleNext(T0)).isTrue();
            policy.attemptStarted();
            assertThat(policy.scheduleNext(T0.plusSeconds(1))).isTrue();
            policy.attemptStarted();

            assertThat(policy.scheduleNext(T0.plusSeconds(3))).isFalse();
            assertThat(policy.isExhausted()).isTrue();

            policy.reset();
            assertThat(policy.isExhausted()).isFalse();
            assertThat(policy.getAttempts()).isZero();
        }
    }
}
