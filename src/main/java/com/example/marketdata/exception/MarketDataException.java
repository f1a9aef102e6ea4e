package com.example.marketdata.exception;

/**
 * Base of the market data error taxonomy. Carries the vendor, operation and symbol
 * so callers can log and decide their own retry policy.
 */
public class MarketDataException extends RuntimeException {

    private final String vendor;
    private final String operation;
    private final String symbol;

    public MarketDataException(String vendor, String operation, String symbol, String message) {
        super(format(vendor, operation, symbol, message));
        this.vendor = vendor;
        this.operation = operation;
        this.symbol = symbol;
    }

    public MarketDataException(String vendor, String operation, String symbol, String message, Throwable cause) {
        super(format(vendor, operation, symbol, message), cause);
        this.vendor = vendor;
        this.operation = operation;
        this.symbol = symbol;
    }

    public String getVendor() {
        return vendor;
    }

    public String getOperation() {
        return operation;
    }

    public String getSymbol() {
        return symbol;
    }

    private static String format(String vendor, String operation, String symbol, String message) {
        StringBuilder sb = new StringBuilder("[").append(vendor != null ? vendor : "?");
        if (operation != null) {
            sb.append(' ').append(operation);
        }
        if (symbol != null) {
            sb.append(' ').append(symbol);
        }
        return sb.append("] ").append(message).toString();
    }
}
