package com.example.chatpipeline.dispatch;

import com.example.chatpipeline.error.TransientDispatchException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BoundedCallTest {

    private final ExecutorService executor = BoundedCall.newCallExecutor("test-call", 2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testRun_ReturnsValue() {
        assertEquals("ok", BoundedCall.run(() -> "ok", executor, Duration.ofSeconds(1), "call"));
    }

    @Test
    void testRun_TimeoutBecomesTransient() {
        TransientDispatchException e = assertThrows(TransientDispatchException.class,
                () -> BoundedCall.run(() -> {
                    try {
                        Thread.sleep(2_000);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                    }
                    return "late";
                }, executor, Duration.ofMillis(50), "slow call"));

        assertTrue(e.getMessage().contains("slow call timed out"));
    }

    @Test
    void testRun_FailureBecomesTransientWithCause() {
        TransientDispatchException e = assertThrows(TransientDispatchException.class,
                () -> BoundedCall.run(() -> {
                    throw new IllegalArgumentException("bad input");
                }, executor, Duration.ofSeconds(1), "failing call"));

        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertEquals("TRANSIENT_DISPATCH", e.getCode());
    }

    @Test
    void testRun_TimedOutCallsAreInterruptedAndPoolStaysBounded() throws InterruptedException {
        // Given a callee that blocks until interrupted
        CountDownLatch never = new CountDownLatch(1);
        AtomicInteger started = new AtomicInteger();
        AtomicInteger interrupted = new AtomicInteger();

        // When
        for (int i = 0; i < 20; i++) {
            assertThrows(TransientDispatchException.class, () -> BoundedCall.run(() -> {
                started.incrementAndGet();
                try {
                    never.await();
                } catch (InterruptedException ie) {
                    interrupted.incrementAndGet();
                    Thread.currentThread().interrupt();
                }
                return "late";
            }, executor, Duration.ofMillis(20), "blocked call"));
        }
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (interrupted.get() < started.get() && System.nanoTime() < deadline) {
            TimeUnit.MILLISECONDS.sleep(10);
        }

        // Then
        assertTrue(started.get() > 0);
        assertEquals(started.get(), interrupted.get());
        assertTrue(((ThreadPoolExecutor) executor).getPoolSize() <= 2);
        assertEquals("ok", BoundedCall.run(() -> "ok", executor, Duration.ofSeconds(1), "call"));
    }
}
