package com.atlas.journal.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.atlas.journal.config.properties.RetryConfigurationProperties;
import com.atlas.journal.exception.RetryExhaustedException;

@DisplayName("Batch Retry Scheduler Tests")
class BatchRetrySchedulerTest {

    private List<Long> sleeps;
    private BatchRetryScheduler scheduler;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        scheduler = new BatchRetryScheduler(RetryConfigurationProperties.defaults(), sleeps::add);
    }

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    // ==================== Backoff schedule ====================

    @Test
    @DisplayName("Should double the delay for each retry")
    void shouldDoubleDelay() {
        assertThat(scheduler.calculateRetryDelay(0)).isEqualTo(1000L);
        assertThat(scheduler.calculateRetryDelay(1)).isEqualTo(2000L);
        assertThat(scheduler.calculateRetryDelay(2)).isEqualTo(4000L);
    }

    @Test
    @DisplayName("Should allow retries only up to the configured maximum")
    void shouldRetryUpToMax() {
        assertThat(scheduler.shouldRetry(0)).isTrue();
        assertThat(scheduler.shouldRetry(2)).isTrue();
        assertThat(scheduler.shouldRetry(3)).isFalse();
    }

    // ==================== Execution ====================

    @Test
    @DisplayName("Should not wait when the first attempt succeeds")
    void shouldSucceedFirstTime() {
        List<String> delivered = new ArrayList<>();

        scheduler.execute("payload", delivered::add);

        assertThat(delivered).containsExactly("payload");
        assertThat(sleeps).isEmpty();
        assertThat(scheduler.getRetryMetrics().getSuccessfulDeliveries()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should wait 1000 ms then 2000 ms before succeeding on the third attempt")
    void shouldBackOffBetweenAttempts() {
        AtomicInteger calls = new AtomicInteger();

        scheduler.execute("payload", payload -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("sink unavailable");
            }
        });

        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(1000L, 2000L);

        BatchRetryScheduler.RetryMetrics metrics = scheduler.getRetryMetrics();
        assertThat(metrics.getTotalAttempts()).isEqualTo(3);
        assertThat(metrics.getTotalRetries()).isEqualTo(2);
        assertThat(metrics.getSuccessRate()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should give up after max retries with the last error")
    void shouldExhaustRetries() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> scheduler.execute("payload", payload -> {
            throw new IllegalStateException("failure " + calls.incrementAndGet());
        }))
                .isInstanceOfSatisfying(RetryExhaustedException.class, e -> {
                    assertThat(e.getAttempts()).isEqualTo(4);
                    assertThat(e.getLastError()).hasMessage("failure 4");
                });

        assertThat(calls.get()).isEqualTo(4);
        assertThat(sleeps).containsExactly(1000L, 2000L, 4000L);
        assertThat(scheduler.getRetryMetrics().getExhaustedDeliveries()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should make a single attempt when retries are disabled")
    void shouldNotRetryWhenDisabled() {
        BatchRetryScheduler noRetries =
                new BatchRetryScheduler(new RetryConfigurationProperties(0, 1000L), sleeps::add);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> noRetries.execute("payload", payload -> {
            calls.incrementAndGet();
            throw new IllegalStateException("down");
        })).isInstanceOf(RetryExhaustedException.class);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Should abort on interrupt and keep the interrupt flag")
    void shouldAbortWhenInterrupted() {
        BatchRetryScheduler interruptible = new BatchRetryScheduler(
                RetryConfigurationProperties.defaults(),
                millis -> {
                    throw new InterruptedException("shutdown");
                });
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> interruptible.execute("payload", payload -> {
            calls.incrementAndGet();
            throw new IllegalStateException("down");
        }))
                .isInstanceOf(RetryExhaustedException.class)
                .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    @DisplayName("Should reset metrics")
    void shouldResetMetrics() {
        scheduler.execute("payload", payload -> { });
        scheduler.resetMetrics();

        assertThat(scheduler.getRetryMetrics().getTotalAttempts()).isZero();
        assertThat(scheduler.getRetryMetrics().getSuccessRate()).isZero();
    }
}
