package com.example.chatpipeline.dispatch;

import com.example.chatpipeline.error.TransientDispatchException;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs a potentially slow collaborator call on a side executor and waits for it with a deadline.
 * Timeouts and failures surface as {@link TransientDispatchException}. A call that misses its
 * deadline is cancelled with interruption, so it frees its worker if the callee honours interrupts.
 */
public final class BoundedCall {

    private BoundedCall() {
    }

    public static <T> T run(Supplier<T> call, ExecutorService executor, Duration timeout, String what) {
        Future<T> future = executor.submit(call::get);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientDispatchException(what + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TransientDispatchException) {
                throw (TransientDispatchException) cause;
            }
            throw new TransientDispatchException(what + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TransientDispatchException(what + " interrupted", e);
        }
    }

    public static ExecutorService newCallExecutor(String threadName, int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, threadName + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
