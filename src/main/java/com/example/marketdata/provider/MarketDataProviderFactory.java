package com.example.marketdata.provider;

import com.example.marketdata.exception.ProviderNotImplementedException;
import com.example.marketdata.exception.UnknownProviderException;
import com.example.marketdata.model.ProviderCredential;
import com.example.marketdata.model.ProviderId;
import com.example.marketdata.provider.alpaca.AlpacaMarketDataProvider;
import com.example.marketdata.provider.alpaca.AlpacaSettings;
import com.example.marketdata.provider.etrade.ETradeMarketDataProvider;
import com.example.marketdata.stream.StreamConnector;
import com.example.marketdata.stream.StreamSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Objects;

/**
 * Builds a provider from a vendor id. Returned providers are not opened.
 */
@Slf4j
public class MarketDataProviderFactory {

    private final AlpacaSettings alpacaSettings;
    private final StreamSettings streamSettings;
    private final ObjectMapper objectMapper;
    private final StreamConnector streamConnector;
    private final Clock clock;

    public MarketDataProviderFactory(AlpacaSettings alpacaSettings,
                                     StreamSettings streamSettings,
                                     ObjectMapper objectMapper) {
        this(alpacaSettings, streamSettings, objectMapper, null, Clock.systemUTC());
    }

    /**
     * @param streamConnector connector handed to streaming providers; null for the JDK WebSocket client
     */
    public MarketDataProviderFactory(AlpacaSettings alpacaSettings,
                                     StreamSettings streamSettings,
                                     ObjectMapper objectMapper,
                                     StreamConnector streamConnector,
                                     Clock clock) {
        this.alpacaSettings = Objects.requireNonNull(alpacaSettings, "alpacaSettings");
        this.streamSettings = Objects.requireNonNull(streamSettings, "streamSettings");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.streamConnector = streamConnector;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws UnknownProviderException        for an unrecognized id
     * @throws ProviderNotImplementedException for a recognized vendor with no integration
     */
    public MarketDataProvider createProvider(String vendorId, ProviderCredential credential) {
        ProviderId providerId = ProviderId.fromId(vendorId)
            .orElseThrow(() -> new UnknownProviderException(vendorId));
        return createProvider(providerId, credential);
    }

    public MarketDataProvider createProvider(ProviderId providerId, ProviderCredential credential) {
        Objects.requireNonNull(providerId, "providerId");
        ProviderCredential effective = credential != null ? credential : ProviderCredential.of(null, null);

        switch (providerId) {
            case ALPACA:
                log.info("Creating Alpaca market data provider");
                return new AlpacaMarketDataProvider(alpacaSettings, streamSettings, effective,
                    objectMapper, streamConnector, clock);
            case ETRADE:
                log.info("Creating E*TRADE market data provider (stub)");
                return new ETradeMarketDataProvider(effective);
            case FIDELITY:
            case POLYGON:
            case IEX:
                throw new ProviderNotImplementedException(providerId.id(),
                    "Provider '" + providerId.id() + "' is recognized but not implemented");
            default:
                throw new UnknownProviderException(providerId.id());
        }
    }
}
