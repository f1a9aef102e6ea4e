package com.example.marketdata.provider.alpaca;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Endpoints and limits for the Alpaca market data API.
 */
@Value
@Builder
public class AlpacaSettings {

    @Builder.Default
    String dataUrl = "https://data.alpaca.markets";

    @Builder.Default
    String streamUrl = "wss://stream.data.alpaca.markets/v2";

    /** Stock feed: iex (free) or sip. */
    @Builder.Default
    String feed = "iex";

    /** Options feed: indicative (free) or opra. */
    @Builder.Default
    String optionsFeed = "indicative";

    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(10);

    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(10);

    @Builder.Default
    int barLimit = 10000;

    @Builder.Default
    int optionsPageLimit = 1000;

    public static AlpacaSettings defaults() {
        return AlpacaSettings.builder().build();
    }
}
