package com.condortrader.recovery;

/**
 * A component holding trading state that must reach durable storage before the process
 * ends, whether it ends gracefully or on a fatal error.
 */
public interface ShutdownParticipant {

    /**
     * Flushes the order-event log and snapshots open positions. Best effort and callable
     * from any thread, including the decision thread.
     */
    void persistState();

    /** Persists state, then stops feeds, recorders and worker threads. Idempotent. */
    void shutdown();
}
