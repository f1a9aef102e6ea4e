package com.example.marketdata.model;

/**
 * Operations a market data provider may offer.
 */
public enum Capability {
    HISTORICAL_BARS("fetchBars"),
    LATEST_QUOTE("fetchLatestQuote"),
    TRADE_STREAM("streamTrades"),
    OPTIONS_CHAIN("fetchOptionsChain");

    private final String operation;

    Capability(String operation) {
        this.operation = operation;
    }

    /**
     * Name of the provider method behind this capability, as carried in error context.
     */
    public String operation() {
        return operation;
    }
}
