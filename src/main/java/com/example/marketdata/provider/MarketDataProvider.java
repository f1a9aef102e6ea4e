package com.example.marketdata.provider;

import com.example.marketdata.model.Capability;
import com.example.marketdata.model.MarketData;
import com.example.marketdata.model.OptionsQuote;
import com.example.marketdata.model.ProviderId;
import com.example.marketdata.model.Timeframe;
import com.example.marketdata.stream.TradeStream;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Interface for market data providers.
 * Implementations include Alpaca (full) and E*TRADE (stub); others are recognized by
 * {@link MarketDataProviderFactory} but not implemented.
 *
 * <p>A provider must be opened before use and closed afterwards:
 * <pre>
 * try (MarketDataProvider provider = factory.createProvider("alpaca", credential).open()) {
 *     List&lt;MarketData&gt; bars = provider.fetchBars("AAPL", start, end, Timeframe.ONE_DAY);
 * }
 * </pre>
 *
 * <p>An operation the provider never offers fails with
 * {@link com.example.marketdata.exception.CapabilityNotSupportedException}; one the vendor
 * offers but this integration lacks fails with
 * {@link com.example.marketdata.exception.ProviderNotImplementedException}. Neither ever
 * returns an empty result in place of the error.
 */
public interface MarketDataProvider extends AutoCloseable {

    ProviderId id();

    Set<Capability> capabilities();

    default boolean supports(Capability capability) {
        return capabilities().contains(capability);
    }

    /**
     * Acquire the provider's transport resources. Idempotent.
     *
     * @return this provider, for try-with-resources
     */
    MarketDataProvider open();

    boolean isOpen();

    /**
     * Historical bars in ascending timestamp order, each within [start, end].
     * An empty list means no bars in the range; transport failures throw.
     */
    List<MarketData> fetchBars(String symbol, Instant start, Instant end, Timeframe timeframe);

    /**
     * Current bid/ask midpoint as {@code close}, with open, high, low and volume zero-filled.
     */
    MarketData fetchLatestQuote(String symbol);

    /**
     * Subscribe to trades and push one record per trade to {@code sink}, in transport order.
     * Returns after the subscription handshake; the sink runs on a provider thread.
     */
    TradeStream streamTrades(List<String> symbols, Consumer<MarketData> sink);

    /**
     * Options chain, optionally filtered by expiration date. Empty when the vendor has no
     * options data for the symbol or the account's tier lacks options.
     */
    List<OptionsQuote> fetchOptionsChain(String symbol, LocalDate expiration);

    default List<OptionsQuote> fetchOptionsChain(String symbol) {
        return fetchOptionsChain(symbol, null);
    }

    /**
     * Release every transport resource, including running trade streams.
     */
    @Override
    void close();
}
