package com.example.marketdata.exception;

/**
 * Network, HTTP or WebSocket failure. {@link #getStatusCode()} is -1 when no HTTP
 * response was received.
 */
public class TransportException extends MarketDataException {

    private final int statusCode;

    public TransportException(String vendor, String operation, String symbol, String message) {
        super(vendor, operation, symbol, message);
        this.statusCode = -1;
    }

    public TransportException(String vendor, String operation, String symbol, String message, Throwable cause) {
        super(vendor, operation, symbol, message, cause);
        this.statusCode = -1;
    }

    public TransportException(String vendor, String operation, String symbol, int statusCode, String message) {
        super(vendor, operation, symbol, "HTTP " + statusCode + " => " + message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode > 0;
    }
}
