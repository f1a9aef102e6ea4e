package com.example.marketdata.model;

import lombok.ToString;
import lombok.Value;

/**
 * API key plus optional secret. Opaque to the core; passed through to
 * transport headers and the streaming handshake.
 */
@Value
public class ProviderCredential {

    String apiKey;

    @ToString.Exclude
    String apiSecret;

    public static ProviderCredential of(String apiKey, String apiSecret) {
        return new ProviderCredential(apiKey, apiSecret);
    }

    public static ProviderCredential of(String apiKey) {
        return new ProviderCredential(apiKey, null);
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
