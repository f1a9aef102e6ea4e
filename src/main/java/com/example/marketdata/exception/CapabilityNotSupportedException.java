package com.example.marketdata.exception;

import com.example.marketdata.model.Capability;

/**
 * The provider never offers this capability. Distinct from an empty result.
 */
public class CapabilityNotSupportedException extends MarketDataException {

    private final Capability capability;

    public CapabilityNotSupportedException(String vendor, Capability capability, String symbol) {
        super(vendor, capability.operation(), symbol, capability + " is not supported by " + vendor);
        this.capability = capability;
    }

    public Capability getCapability() {
        return capability;
    }
}
