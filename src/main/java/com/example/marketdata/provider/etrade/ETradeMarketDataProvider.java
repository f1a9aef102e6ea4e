package com.example.marketdata.provider.etrade;

import com.example.marketdata.exception.CapabilityNotSupportedException;
import com.example.marketdata.exception.ProviderNotImplementedException;
import com.example.marketdata.model.Capability;
import com.example.marketdata.model.MarketData;
import com.example.marketdata.model.OptionsQuote;
import com.example.marketdata.model.ProviderCredential;
import com.example.marketdata.model.ProviderId;
import com.example.marketdata.model.Timeframe;
import com.example.marketdata.provider.MarketDataProvider;
import com.example.marketdata.stream.TradeStream;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * E*TRADE placeholder.
 * E*TRADE requires an OAuth 1.0a flow that is not built yet, so every REST operation
 * fails with {@link ProviderNotImplementedException}. E*TRADE offers no public trade
 * stream, so {@link #streamTrades} fails with {@link CapabilityNotSupportedException}.
 */
@Slf4j
public class ETradeMarketDataProvider implements MarketDataProvider {

    private static final String VENDOR = ProviderId.ETRADE.id();

    private final ProviderCredential credential;
    private volatile boolean open;

    public ETradeMarketDataProvider(ProviderCredential credential) {
        this.credential = Objects.requireNonNull(credential, "credential");
    }

    @Override
    public ProviderId id() {
        return ProviderId.ETRADE;
    }

    @Override
    public Set<Capability> capabilities() {
        return Collections.emptySet();
    }

    @Override
    public MarketDataProvider open() {
        if (!open) {
            log.warn("E*TRADE market data is not implemented (OAuth flow pending). credentialsConfigured={}",
                credential.isConfigured());
            open = true;
        }
        return this;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public List<MarketData> fetchBars(String symbol, Instant start, Instant end, Timeframe timeframe) {
        throw notImplemented(Capability.HISTORICAL_BARS, symbol);
    }

    @Override
    public MarketData fetchLatestQuote(String symbol) {
        throw notImplemented(Capability.LATEST_QUOTE, symbol);
    }

    @Override
    public TradeStream streamTrades(List<String> symbols, Consumer<MarketData> sink) {
        throw new CapabilityNotSupportedException(VENDOR, Capability.TRADE_STREAM,
            symbols != null ? String.join(",", symbols) : null);
    }

    @Override
    public List<OptionsQuote> fetchOptionsChain(String symbol, LocalDate expiration) {
        throw notImplemented(Capability.OPTIONS_CHAIN, symbol);
    }

    @Override
    public void close() {
        open = false;
    }

    private static ProviderNotImplementedException notImplemented(Capability capability, String symbol) {
        return new ProviderNotImplementedException(VENDOR, capability, symbol,
            "E*TRADE " + capability + " requires OAuth 1.0a, which is not implemented");
    }
}
