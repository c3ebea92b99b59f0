package com.kmg.grading.service;

import com.kmg.grading.client.GradingServiceClient.RateLimitedException;
import com.kmg.grading.client.GradingServiceClient.ServiceCallException;
import com.kmg.grading.config.GradingProperties;
import com.kmg.grading.model.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs one call against the grading service, waiting out rate limits. A server-supplied wait is
 * honoured as given; otherwise the delay doubles from the base delay up to the cap. Other errors are
 * returned immediately.
 */
@Component
public class RateLimitedClient {
    private static final Logger log = LoggerFactory.getLogger(RateLimitedClient.class);

    private final Sleeper sleeper;
    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;

    @Autowired
    public RateLimitedClient(Sleeper sleeper, GradingProperties properties) {
        this(sleeper, properties.getRetry().getMaxRetries(), properties.getRetry().getBaseDelay(),
                properties.getRetry().getMaxDelay());
    }

    public RateLimitedClient(Sleeper sleeper, int maxRetries, Duration baseDelay, Duration maxDelay) {
        this.sleeper = sleeper;
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    public <T> CallOutcome<T> call(String operation, Supplier<T> request, CancellationToken cancellation) {
        return call(operation, request, cancellation, BackoffListener.NONE);
    }

    public <T> CallOutcome<T> call(String operation, Supplier<T> request, CancellationToken cancellation,
                                   BackoffListener listener) {
        int retries = 0;
        Duration waited = Duration.ZERO;

        while (true) {
            try {
                T payload = request.get();
                return CallOutcome.success(payload, retries + 1, waited);
            } catch (RateLimitedException e) {
                if (retries >= maxRetries) {
                    log.warn("{}: still rate limited after {} retries ({} waited)", operation, retries, waited);
                    return CallOutcome.failure(CallOutcome.Kind.RATE_LIMIT_EXHAUSTED,
                            "Rate limit persisted after " + retries + " retries", retries + 1, waited);
                }

                Duration delay = e.retryAfter().orElse(backoffDelay(retries));
                retries++;
                log.info("{}: rate limited, retry {}/{} in {}", operation, retries, maxRetries, delay);
                listener.onBackoff(operation, retries, maxRetries, delay);

                if (cancellation.isCancellationRequested()) {
                    return cancelled(retries, waited);
                }
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    return cancelled(retries, waited);
                }
                waited = waited.plus(delay);
                if (cancellation.isCancellationRequested()) {
                    return cancelled(retries, waited);
                }
            } catch (ServiceCallException e) {
                log.warn("{}: grading service error (status {}): {}", operation, e.statusCode(), e.getMessage());
                return CallOutcome.failure(CallOutcome.Kind.SERVICE_ERROR, e.getMessage(), retries + 1, waited);
            }
        }
    }

    Duration backoffDelay(int retryIndex) {
        int shift = Math.min(retryIndex, 30);
        Duration candidate = baseDelay.multipliedBy(1L << shift);
        return candidate.compareTo(maxDelay) > 0 ? maxDelay : candidate;
    }

    private static <T> CallOutcome<T> cancelled(int retries, Duration waited) {
        return CallOutcome.failure(CallOutcome.Kind.CANCELLED, "Cancelled while rate limited", retries, waited);
    }

    @FunctionalInterface
    public interface BackoffListener {
        BackoffListener NONE = (operation, retry, maxRetries, delay) -> {
        };

        void onBackoff(String operation, int retry, int maxRetries, Duration delay);
    }
}
