package com.duelo.engine.provider;

import java.util.concurrent.Future;

/**
 * Cancellation flag shared between the caller of an execution and the thread waiting on the provider.
 */
public class CancellationSignal {

    private volatile boolean cancelled;
    private volatile Future<?> inFlight;

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        cancelled = true;
        Future<?> future = inFlight;
        if (future != null) {
            future.cancel(true);
        }
    }

    void attach(Future<?> future) {
        inFlight = future;
        if (cancelled) {
            future.cancel(true);
        }
    }

    void detach() {
        inFlight = null;
    }
}
