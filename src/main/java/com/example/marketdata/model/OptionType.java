package com.example.marketdata.model;

public enum OptionType {
    CALL,
    PUT;

    /**
     * Resolves the OCC type letter (C/P).
     */
    public static OptionType fromOccCode(char code) {
        switch (Character.toUpperCase(code)) {
            case 'C':
                return CALL;
            case 'P':
                return PUT;
            default:
                throw new IllegalArgumentException("Unknown option type code: " + code);
        }
    }
}
