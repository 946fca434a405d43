package com.atlas.journal.service;

import java.util.concurrent.atomic.AtomicLong;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.atlas.journal.config.properties.RetryConfigurationProperties;
import com.atlas.journal.exception.RetryExhaustedException;

import lombok.extern.slf4j.Slf4j;

/**
 * Bounded retry with exponential backoff for deliveries to the journal sink.
 *
 * <p>Both sink paths (location fixes and photo clusters) go through this one component, so every
 * delivery obeys the same limits:
 *
 * <ul>
 *   <li>the first attempt is followed by at most {@code maxRetries} retries
 *   <li>the wait before retry {@code n} (0-based) is {@code retryBaseDelayMs * 2^n}, without jitter
 *       (1s, 2s, 4s with the defaults)
 *   <li>after the last failure the sequence ends with {@link RetryExhaustedException} carrying
 *       the last error
 * </ul>
 *
 * <p>Backoff waits block the calling thread and are interruptible. An interrupt ends the
 * sequence with {@link RetryExhaustedException} and leaves the thread's interrupt flag set, so a
 * cancelled flush never outlives its caller.
 *
 * @see LocationIngestPipeline
 * @see PhotoCurationService
 */
@Slf4j
@Service
public class BatchRetryScheduler {

    /**
     * One delivery attempt. Any exception counts as a failed attempt.
     */
    @FunctionalInterface
    public interface RetryableCall<T> {
        void call(T payload) throws Exception;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxRetries;
    private final long retryBaseDelayMs;
    private final Sleeper sleeper;

    // Retry tracking metrics
    private final AtomicLong totalAttempts = new AtomicLong(0);
    private final AtomicLong totalRetries = new AtomicLong(0);
    private final AtomicLong successfulDeliveries = new AtomicLong(0);
    private final AtomicLong exhaustedDeliveries = new AtomicLong(0);

    @Autowired
    public BatchRetryScheduler(RetryConfigurationProperties config) {
        this(config, Thread::sleep);
    }

    BatchRetryScheduler(RetryConfigurationProperties config, Sleeper sleeper) {
        this.maxRetries = config.maxRetries();
        this.retryBaseDelayMs = config.retryBaseDelayMs();
        this.sleeper = sleeper;

        log.info("BatchRetryScheduler initialized: maxRetries={}, baseDelay={}ms",
                maxRetries, retryBaseDelayMs);
    }

    public <T> void execute(T payload, RetryableCall<T> operation) {
        execute("delivery", payload, operation);
    }

    /**
     * Runs the operation against the payload until it succeeds or the retries run out.
     *
     * @param operationName label used in log lines and the exhaustion message
     * @throws RetryExhaustedException when every attempt failed or a backoff wait was interrupted
     */
    public <T> void execute(String operationName, T payload, RetryableCall<T> operation) {
        RetryableOperation<T> retryable = new RetryableOperation<>(payload);
        Exception lastError = null;

        while (true) {
            totalAttempts.incrementAndGet();
            try {
                operation.call(retryable.getPayload());
                if (retryable.getAttempt() > 0) {
                    log.info("{} succeeded after {} retries", operationName, retryable.getAttempt());
                }
                successfulDeliveries.incrementAndGet();
                return;
            } catch (Exception e) {
                lastError = e;
            }

            if (!shouldRetry(retryable.getAttempt())) {
                exhaustedDeliveries.incrementAndGet();
                int attempts = retryable.getAttempt() + 1;
                log.error("{} failed after {} attempts: {}", operationName, attempts, lastError.getMessage());
                throw new RetryExhaustedException(
                        operationName + " failed after " + attempts + " attempts", attempts, lastError);
            }

            retryable.scheduleRetry(calculateRetryDelay(retryable.getAttempt()));
            log.warn("{} attempt {} failed ({}), retrying in {}ms",
                    operationName, retryable.getAttempt(), lastError.getMessage(), retryable.getNextDelayMs());
            totalRetries.incrementAndGet();

            try {
                sleeper.sleep(retryable.getNextDelayMs());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                exhaustedDeliveries.incrementAndGet();
                log.warn("{} interrupted during backoff after {} attempts", operationName, retryable.getAttempt());
                throw new RetryExhaustedException(
                        operationName + " interrupted after " + retryable.getAttempt() + " attempts",
                        retryable.getAttempt(), lastError);
            }
        }
    }

    /**
     * Whether another attempt is allowed after the given number of retries.
     *
     * @param retriesSoFar retries already made (0-based)
     */
    public boolean shouldRetry(int retriesSoFar) {
        return retriesSoFar < maxRetries;
    }

    /**
     * Backoff before retry {@code retryIndex}: {@code base * 2^retryIndex} milliseconds.
     */
    public long calculateRetryDelay(int retryIndex) {
        return retryBaseDelayMs * (1L << Math.min(retryIndex, 30));
    }

    public RetryMetrics getRetryMetrics() {
        return new RetryMetrics(
                totalAttempts.get(),
                totalRetries.get(),
                successfulDeliveries.get(),
                exhaustedDeliveries.get());
    }

    public void resetMetrics() {
        totalAttempts.set(0);
        totalRetries.set(0);
        successfulDeliveries.set(0);
        exhaustedDeliveries.set(0);
        log.info("Batch retry scheduler metrics reset");
    }

    /**
     * State of one retry sequence. Lives only for the duration of {@link #execute}.
     */
    static final class RetryableOperation<T> {
        private final T payload;
        private int attempt;
        private long nextDelayMs;

        RetryableOperation(T payload) {
            this.payload = payload;
        }

        void scheduleRetry(long delayMs) {
            this.attempt++;
            this.nextDelayMs = delayMs;
        }

        T getPayload() { return payload; }
        int getAttempt() { return attempt; }
        long getNextDelayMs() { return nextDelayMs; }
    }

    /**
     * Snapshot of retry counters.
     */
    public static class RetryMetrics {
        private final long totalAttempts;
        private final long totalRetries;
        private final long successfulDeliveries;
        private final long exhaustedDeliveries;

        public RetryMetrics(long totalAttempts, long totalRetries,
                            long successfulDeliveries, long exhaustedDeliveries) {
            this.totalAttempts = totalAttempts;
            this.totalRetries = totalRetries;
            this.successfulDeliveries = successfulDeliveries;
            this.exhaustedDeliveries = exhaustedDeliveries;
        }

        // Getters
        public long getTotalAttempts() { return totalAttempts; }
        public long getTotalRetries() { return totalRetries; }
        public long getSuccessfulDeliveries() { return successfulDeliveries; }
        public long getExhaustedDeliveries() { return exhaustedDeliveries; }

        public double getSuccessRate() {
            long completed = successfulDeliveries + exhaustedDeliveries;
            return completed > 0 ? (double) successfulDeliveries / completed : 0.0;
        }

        @Override
        public String toString() {
            return String.format("RetryMetrics{attempts=%d, retries=%d, successful=%d, exhausted=%d, successRate=%.2f%%}",
                    totalAttempts, totalRetries, successfulDeliveries, exhaustedDeliveries, getSuccessRate() * 100);
        }
    }
}
