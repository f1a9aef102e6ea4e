package com.example.marketdata.exception;

public class UnknownProviderException extends MarketDataException {

    public UnknownProviderException(String vendorId) {
        super(vendorId, "createProvider", null, "Unknown provider: " + vendorId);
    }
}
