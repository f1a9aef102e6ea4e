package com.example.marketdata.exception;

public class AuthenticationFailedException extends MarketDataException {

    public AuthenticationFailedException(String vendor, String operation, String symbol, String message) {
        super(vendor, operation, symbol, message);
    }
}
