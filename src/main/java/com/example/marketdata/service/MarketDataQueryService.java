package com.example.marketdata.service;

import com.example.marketdata.model.Capability;
import com.example.marketdata.model.MarketData;
import com.example.marketdata.model.OptionsQuote;
import com.example.marketdata.model.Timeframe;
import com.example.marketdata.provider.MarketDataProvider;
import com.example.marketdata.quality.BarQualityChecker;
import com.example.marketdata.quality.QualityReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Request/response access to the configured provider.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketDataQueryService {

    private final MarketDataProvider provider;
    private final BarQualityChecker qualityChecker;

    public String getProviderName() {
        return provider.id().id();
    }

    public Set<Capability> getCapabilities() {
        return provider.capabilities();
    }

    public List<MarketData> getBars(String symbol, Instant start, Instant end, Timeframe timeframe) {
        return provider.fetchBars(symbol, start, end, timeframe);
    }

    public MarketData getLatestQuote(String symbol) {
        return provider.fetchLatestQuote(symbol);
    }

    public List<OptionsQuote> getOptionsChain(String symbol, LocalDate expiration) {
        return provider.fetchOptionsChain(symbol, expiration);
    }

    /**
     * Fetch bars for the range and run every quality check over them.
     */
    public QualityReport checkQuality(String symbol, Instant start, Instant end, Timeframe timeframe) {
        List<MarketData> bars = provider.fetchBars(symbol, start, end, timeframe);
        log.debug("Running quality checks over {} {} bars for {}", bars.size(), timeframe, symbol);
        return qualityChecker.runFullCheck(Map.of(symbol.trim().toUpperCase(Locale.ROOT), bars), timeframe);
    }
}
