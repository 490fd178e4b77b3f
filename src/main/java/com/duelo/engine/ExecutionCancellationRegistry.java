package com.duelo.engine;

import com.duelo.engine.provider.CancellationSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks in-flight executions so that they can be cancelled from another thread.
 */
@Component
@Slf4j
public class ExecutionCancellationRegistry {

    private final Map<UUID, CancellationSignal> inFlight = new ConcurrentHashMap<>();

    public CancellationSignal register(UUID executionId) {
        CancellationSignal signal = new CancellationSignal();
        inFlight.put(executionId, signal);
        return signal;
    }

    /**
     * @return {@code false} when the execution is unknown or already finished
     */
    public boolean cancel(UUID executionId) {
        CancellationSignal signal = inFlight.get(executionId);
        if (signal == null) {
            return false;
        }
        signal.cancel();
        log.info("Cancellation requested for execution {}.", executionId);
        return true;
    }

    public boolean isInFlight(UUID executionId) {
        return inFlight.containsKey(executionId);
    }

    public void release(UUID executionId) {
        inFlight.remove(executionId);
    }
}
