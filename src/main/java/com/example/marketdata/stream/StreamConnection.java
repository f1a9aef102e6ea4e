package com.example.marketdata.stream;

import java.io.IOException;

/**
 * An open WebSocket owned by exactly one {@link TradeStreamSession}.
 */
public interface StreamConnection {

    void send(String message) throws IOException;

    boolean isOpen();

    /**
     * Closes the connection and releases its resources. Idempotent; never throws.
     */
    void close();
}
