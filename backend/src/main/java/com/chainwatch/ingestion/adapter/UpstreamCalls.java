package com.chainwatch.ingestion.adapter;

import com.chainwatch.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Retry loop shared by the provider clients.
 */
@Slf4j
public final class UpstreamCalls {

    private UpstreamCalls() {
    }

    /**
     * Runs {@code call} up to {@link RetryPolicy#getMaxAttempts()} times, sleeping the policy's backoff between
     * attempts. The last failure is rethrown as {@link UpstreamException}.
     */
    public static <T> T withRetry(RetryPolicy retryPolicy, String operation, Supplier<T> call) {
        RuntimeException lastException = null;
        for (int attempt = 0; attempt < retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(retryPolicy.delayMs(attempt - 1));
                log.debug("Retrying {} (attempt {}/{})", operation, attempt + 1, retryPolicy.getMaxAttempts());
            }
            try {
                return call.get();
            } catch (RuntimeException e) {
                lastException = e;
            }
        }
        throw new UpstreamException(operation + " failed after " + retryPolicy.getMaxAttempts() + " attempt(s): "
                + messageOf(lastException), lastException);
    }

    static String messageOf(Exception e) {
        if (e == null) {
            return "unknown";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("Interrupted during upstream retry", e);
        }
    }
}
