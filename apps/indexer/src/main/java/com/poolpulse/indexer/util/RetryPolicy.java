package com.poolpulse.indexer.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Fixed-delay retry with a per-attempt timeout.
 * One instance is shared by every caller of the same upstream.
 */
public class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private static final ExecutorService ATTEMPT_EXECUTOR = Executors.newCachedThreadPool(new DaemonThreadFactory());

    private final int attempts;
    private final Duration delay;
    private final Duration timeout;
    private final Predicate<Exception> retryOn;

    public RetryPolicy(int attempts, Duration delay, Duration timeout) {
        this(attempts, delay, timeout, e -> true);
    }

    private RetryPolicy(int attempts, Duration delay, Duration timeout, Predicate<Exception> retryOn) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1");
        }
        this.attempts = attempts;
        this.delay = delay;
        this.timeout = timeout;
        this.retryOn = retryOn;
    }

    /**
     * Copy of this policy that only retries failures matching the predicate.
     * Other failures are rethrown on the first attempt.
     */
    public RetryPolicy retryingOn(Predicate<Exception> predicate) {
        return new RetryPolicy(attempts, delay, timeout, predicate);
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getDelay() {
        return delay;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Execute the task until it succeeds or the attempts are exhausted.
     *
     * @param operation Name used in log lines
     * @param task      Task to execute
     * @param <T>       Return type
     * @return Result from the first successful attempt
     * @throws RetryExhaustedException If every attempt failed or timed out
     */
    public <T> T execute(String operation, RetryableTask<T> task) {
        Exception lastException = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return runAttempt(task);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RetryExhaustedException(operation, attempt, e);
            } catch (Exception e) {
                lastException = e;
                if (!retryOn.test(e)) {
                    if (e instanceof RuntimeException) {
                        throw (RuntimeException) e;
                    }
                    throw new RetryExhaustedException(operation, attempt, e);
                }
                if (attempt < attempts) {
                    logger.warn("{} attempt {}/{} failed, retrying in {}ms: {}",
                            operation, attempt, attempts, delay.toMillis(), e.getMessage());
                    try {
                        Thread.sleep(delay.toMillis());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RetryExhaustedException(operation, attempt, ie);
                    }
                }
            }
        }
        logger.error("{} failed after {} attempts", operation, attempts);
        throw new RetryExhaustedException(operation, attempts, lastException);
    }

    /**
     * Same as {@link #execute} but returns null once the attempts are exhausted.
     */
    public <T> T executeOrNull(String operation, RetryableTask<T> task) {
        try {
            return execute(operation, task);
        } catch (RetryExhaustedException e) {
            logger.warn("{} gave up: {}", operation, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return null;
        }
    }

    private <T> T runAttempt(RetryableTask<T> task) throws Exception {
        Future<T> future = ATTEMPT_EXECUTOR.submit(task::execute);

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // Interrupts the attempt thread so a blocked call does not hold it past the timeout.
            future.cancel(true);
            throw new TimeoutException("attempt timed out after " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception) {
                throw (Exception) e.getCause();
            }
            throw e;
        }
    }

    @Override
    public String toString() {
        return "RetryPolicy{attempts=" + attempts + ", delay=" + delay + ", timeout=" + timeout + "}";
    }

    /**
     * Functional interface for retryable task
     */
    @FunctionalInterface
    public interface RetryableTask<T> {
        T execute() throws Exception;
    }

    private static final class DaemonThreadFactory implements java.util.concurrent.ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "retry-attempt-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
