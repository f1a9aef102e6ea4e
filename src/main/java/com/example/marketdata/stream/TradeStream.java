package com.example.marketdata.stream;

import com.example.marketdata.model.StreamState;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Handle to a running trade subscription. Returned once the auth and subscribe
 * handshake has completed; records flow to the sink until {@link #cancel()} is
 * called or the connection terminates.
 */
public interface TradeStream extends AutoCloseable {

    StreamState state();

    List<String> symbols();

    /**
     * Cooperative cancellation. Returns once the connection is closed and the
     * receive loop has stopped; no sink invocation happens after that. Idempotent.
     */
    void cancel();

    /**
     * Blocks until the stream terminates. Rethrows the failure if it ended in FAILED.
     */
    void await() throws InterruptedException;

    /**
     * Bounded variant of {@link #await()}. Returns false if still running after the timeout.
     */
    boolean await(Duration timeout) throws InterruptedException;

    Optional<Throwable> failure();

    @Override
    default void close() {
        cancel();
    }
}
