package dev.catananti.reviewhub.config;

import io.r2dbc.spi.R2dbcTransientException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Timeouts and retry strategy for store access.
 *
 * <pre>
 * return postRepository.findById(id)
 *         .timeout(resilience.getStoreTimeout())
 *         .retryWhen(resilience.storeReadRetry());
 * </pre>
 *
 * Writes are never retried: a compare-and-set that timed out may already have been applied.
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration storeTimeout;
    private final int storeRetryMaxAttempts;
    private final Duration storeRetryMinBackoff;
    private final Duration storeRetryMaxBackoff;

    public ResilienceConfig(
            @Value("${resilience.store.timeout-seconds:10}") int storeTimeoutSeconds,
            @Value("${resilience.store.retry-max-attempts:3}") int storeRetryMaxAttempts,
            @Value("${resilience.store.retry-min-backoff-ms:100}") int storeRetryMinBackoffMs,
            @Value("${resilience.store.retry-max-backoff-ms:1000}") int storeRetryMaxBackoffMs
    ) {
        this.storeTimeout = Duration.ofSeconds(storeTimeoutSeconds);
        this.storeRetryMaxAttempts = storeRetryMaxAttempts;
        this.storeRetryMinBackoff = Duration.ofMillis(storeRetryMinBackoffMs);
        this.storeRetryMaxBackoff = Duration.ofMillis(storeRetryMaxBackoffMs);
        log.info("Resilience configuration initialized: storeTimeout={}, retries={}", storeTimeout, storeRetryMaxAttempts);
    }

    /**
     * Retry for idempotent reads. Exponential backoff with jitter, transient failures only.
     */
    public Retry storeReadRetry() {
        return Retry.backoff(storeRetryMaxAttempts, storeRetryMinBackoff)
                .maxBackoff(storeRetryMaxBackoff)
                .jitter(0.5)
                .filter(ResilienceConfig::isTransient)
                .doBeforeRetry(signal -> log.warn("Retrying store read, attempt {}/{}: {}",
                        signal.totalRetries() + 1, storeRetryMaxAttempts, signal.failure().getMessage()));
    }

    static boolean isTransient(Throwable throwable) {
        if (throwable instanceof TimeoutException || throwable instanceof R2dbcTransientException) {
            return true;
        }
        String message = throwable.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("connection")
                || lower.contains("timeout")
                || lower.contains("temporarily unavailable")
                || lower.contains("too many connections")
                || lower.contains("deadlock");
    }
}
