package com.relayclaw.dispatch;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-request cancellation handle. The HTTP layer calls {@link #cancel()} when the caller
 * disconnects; the in-flight upstream call is cancelled and the retry loop stops at its
 * next step.
 */
public class DispatchContext {

    private final String requestId;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicReference<CompletableFuture<?>> inFlight = new AtomicReference<>();

    public DispatchContext(String requestId) {
        this.requestId = requestId;
    }

    public String requestId() {
        return requestId;
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        var future = inFlight.get();
        if (future != null) future.cancel(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void checkCancelled() {
        if (cancelled.get()) throw new DispatchCancelledException("Request " + requestId + " cancelled by caller");
    }

    /**
     * Waits for an upstream call while keeping it cancellable.
     *
     * @throws java.util.concurrent.CompletionException if the call failed
     * @throws DispatchCancelledException if the caller went away
     */
    public <T> T await(CompletableFuture<T> future) {
        inFlight.set(future);
        try {
            // cancel() 可能发生在 set 之前
            if (cancelled.get()) future.cancel(true);
            return future.join();
        } catch (CancellationException e) {
            throw new DispatchCancelledException("Request " + requestId + " cancelled by caller", e);
        } finally {
            inFlight.compareAndSet(future, null);
        }
    }
}
