package com.example.marketdata.exception;

import com.example.marketdata.model.Capability;

/**
 * The vendor is recognized but its integration (or this part of it) is not built yet.
 */
public class ProviderNotImplementedException extends MarketDataException {

    private final Capability capability;

    public ProviderNotImplementedException(String vendor, String message) {
        super(vendor, null, null, message);
        this.capability = null;
    }

    public ProviderNotImplementedException(String vendor, Capability capability, String symbol, String message) {
        super(vendor, capability.operation(), symbol, message);
        this.capability = capability;
    }

    /**
     * The missing capability, or null when the whole vendor integration is missing.
     */
    public Capability getCapability() {
        return capability;
    }
}
