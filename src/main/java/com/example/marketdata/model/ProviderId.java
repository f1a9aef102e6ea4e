package com.example.marketdata.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Vendors the factory recognizes. Recognition does not imply an integration exists.
 */
public enum ProviderId {
    ALPACA("alpaca"),
    ETRADE("etrade"),
    FIDELITY("fidelity"),
    POLYGON("polygon"),
    IEX("iex");

    private final String id;

    ProviderId(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<ProviderId> fromId(String vendorId) {
        if (vendorId == null) {
            return Optional.empty();
        }
        String normalized = vendorId.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(p -> p.id.equals(normalized))
            .findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
