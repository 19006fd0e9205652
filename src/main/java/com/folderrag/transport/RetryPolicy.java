package com.folderrag.transport;

import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.folderrag.error.OperationCancelledException;
import com.folderrag.error.ServiceException;
import com.folderrag.error.TransportException;
import com.folderrag.runtime.AppConfig;
import com.folderrag.runtime.CancellationToken;

/**
 * Bounded retry with capped exponential backoff around a single model-server call.
 * Only {@link TransportException} and, when enabled, 5xx {@link ServiceException}s are
 * retried; every other failure propagates on the first attempt.
 */
public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final double backoffMultiplier;
    private final long maxBackoffMs;
    private final boolean retryServerErrors;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts,
            long initialBackoffMs,
            double backoffMultiplier,
            long maxBackoffMs,
            boolean retryServerErrors,
            Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = Math.max(0L, initialBackoffMs);
        this.backoffMultiplier = Math.max(1.0, backoffMultiplier);
        this.maxBackoffMs = Math.max(this.initialBackoffMs, maxBackoffMs);
        this.retryServerErrors = retryServerErrors;
        this.sleeper = sleeper;
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, 0, 1.0, 0, false, Thread::sleep);
    }

    public static RetryPolicy fromConfig(AppConfig.RetryConfig config) {
        return new RetryPolicy(
                config.getMaxAttempts(),
                config.getInitialBackoffMs(),
                config.getBackoffMultiplier(),
                config.getMaxBackoffMs(),
                config.isRetryServerErrors(),
                Thread::sleep);
    }

    public RetryPolicy withSleeper(Sleeper replacement) {
        return new RetryPolicy(maxAttempts, initialBackoffMs, backoffMultiplier, maxBackoffMs, retryServerErrors, replacement);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean isRetryable(RuntimeException failure) {
        if (failure instanceof TransportException) {
            return true;
        }
        return retryServerErrors
                && failure instanceof ServiceException serviceException
                && serviceException.isServerError();
    }

    /**
     * Delay before the attempt that follows {@code failedAttempt} (1-based).
     */
    public long backoffMillis(int failedAttempt) {
        double delay = initialBackoffMs * Math.pow(backoffMultiplier, Math.max(0, failedAttempt - 1));
        return (long) Math.min(delay, maxBackoffMs);
    }

    public <T> T execute(String operation, CancellationToken cancellation, Supplier<T> call) {
        for (int attempt = 1;; attempt++) {
            cancellation.throwIfCancelled(operation);
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts || !isRetryable(e)) {
                    throw e;
                }
                long backoff = backoffMillis(attempt);
                log.warn("retry operation={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        operation, attempt, maxAttempts, backoff, e.getMessage());
                pause(operation, backoff);
            }
        }
    }

    private void pause(String operation, long backoffMs) {
        if (backoffMs <= 0) {
            return;
        }
        try {
            sleeper.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(operation + " interrupted during retry backoff");
        }
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
