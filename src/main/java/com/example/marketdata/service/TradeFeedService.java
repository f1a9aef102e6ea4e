package com.example.marketdata.service;

import com.example.marketdata.exception.MarketDataException;
import com.example.marketdata.model.Capability;
import com.example.marketdata.model.MarketData;
import com.example.marketdata.model.StreamState;
import com.example.marketdata.provider.MarketDataProvider;
import com.example.marketdata.stream.TradeStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Owns the live trade stream of the configured provider.
 * Keeps the latest trade per symbol and fans every trade out to registered callbacks.
 *
 * Set market-data.stream.symbols to start streaming at startup.
 */
@Slf4j
@Service
public class TradeFeedService {

    @Value("${market-data.stream.symbols:}")
    private String autoStartSymbols;

    private final MarketDataProvider provider;

    private final List<Consumer<MarketData>> callbacks = new CopyOnWriteArrayList<>();
    private final Map<String, MarketData> latestTrades = new ConcurrentHashMap<>();

    private TradeStream stream;

    public TradeFeedService(MarketDataProvider provider) {
        this.provider = provider;
    }

    @PostConstruct
    public void init() {
        if (autoStartSymbols == null || autoStartSymbols.isBlank()) {
            log.info("No stream symbols configured, trade feed idle");
            return;
        }
        if (!provider.supports(Capability.TRADE_STREAM)) {
            log.warn("Provider {} has no trade stream; ignoring configured symbols {}",
                provider.id(), autoStartSymbols);
            return;
        }
        List<String> symbols = Arrays.stream(autoStartSymbols.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
        try {
            start(symbols);
        } catch (MarketDataException e) {
            log.error("Failed to start trade feed for {}: {}", symbols, e.getMessage());
        }
    }

    @PreDestroy
    public void cleanup() {
        stop();
    }

    /**
     * Subscribe to trades for the symbols, replacing any running stream.
     */
    public synchronized TradeStream start(List<String> symbols) {
        if (stream != null && !stream.state().isTerminal()) {
            log.info("Replacing trade stream for {}", stream.symbols());
            stream.cancel();
        }
        stream = provider.streamTrades(symbols, this::onTrade);
        log.info("Trade feed streaming {} from {}", stream.symbols(), provider.id());
        return stream;
    }

    /**
     * @return true if a running stream was cancelled
     */
    public synchronized boolean stop() {
        if (stream == null || stream.state().isTerminal()) {
            return false;
        }
        stream.cancel();
        log.info("Trade feed stopped");
        return true;
    }

    public synchronized StreamState getState() {
        return stream != null ? stream.state() : StreamState.DISCONNECTED;
    }

    public synchronized Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("provider", provider.id().id());
        status.put("state", getState());
        status.put("symbols", stream != null ? stream.symbols() : Collections.emptyList());
        if (stream != null) {
            stream.failure().ifPresent(f -> status.put("error", f.getMessage()));
        }
        status.put("trackedSymbols", latestTrades.size());
        return status;
    }

    public Optional<MarketData> getLatestTrade(String symbol) {
        return Optional.ofNullable(latestTrades.get(symbol.trim().toUpperCase(Locale.ROOT)));
    }

    public void registerCallback(Consumer<MarketData> callback) {
        callbacks.add(callback);
    }

    public void removeCallback(Consumer<MarketData> callback) {
        callbacks.remove(callback);
    }

    private void onTrade(MarketData trade) {
        latestTrades.put(trade.getSymbol(), trade);

        // Notify callbacks
        for (Consumer<MarketData> callback : callbacks) {
            try {
                callback.accept(trade);
            } catch (RuntimeException e) {
                log.error("Trade callback failed for {}", trade.getSymbol(), e);
            }
        }
    }
}
