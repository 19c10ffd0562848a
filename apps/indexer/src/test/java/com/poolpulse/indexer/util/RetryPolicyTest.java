package com.poolpulse.indexer.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofSeconds(2));

    @Test
    void returnsFirstSuccessfulAttempt() {
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("flaky", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void throwsWithLastCauseOnceAttemptsAreExhausted() {
        AtomicInteger calls = new AtomicInteger();

        RetryExhaustedException e = assertThrows(RetryExhaustedException.class,
                () -> policy.execute("broken", () -> {
                    throw new IllegalStateException("down " + calls.incrementAndGet());
                }));

        assertEquals(3, calls.get());
        assertEquals(3, e.getAttempts());
        assertEquals("down 3", e.getCause().getMessage());
    }

    @Test
    void executeOrNullReturnsNullWhenExhausted() {
        assertNull(policy.executeOrNull("broken", () -> {
            throw new IllegalStateException("down");
        }));
    }

    @Test
    void timedOutAttemptCountsAsFailure() {
        RetryPolicy quick = new RetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(50));

        RetryExhaustedException e = assertThrows(RetryExhaustedException.class,
                () -> quick.execute("slow", () -> {
                    Thread.sleep(1_000);
                    return "late";
                }));

        assertInstanceOf(java.util.concurrent.TimeoutException.class, e.getCause());
    }

    @Test
    void timedOutAttemptIsInterrupted() throws InterruptedException {
        RetryPolicy single = new RetryPolicy(1, Duration.ofMillis(1), Duration.ofMillis(50));
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThrows(RetryExhaustedException.class, () -> single.execute("blocked", () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "late";
        }));

        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    void nonRetryableFailureIsRethrownImmediately() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy selective = policy.retryingOn(e -> !(e instanceof IllegalArgumentException));

        assertThrows(IllegalArgumentException.class, () -> selective.execute("bad input", () -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("bad");
        }));
        assertEquals(1, calls.get());
    }
}
