package com.example.marketdata.service;

import com.example.marketdata.model.Capability;
import com.example.marketdata.model.MarketData;
import com.example.marketdata.model.OptionsQuote;
import com.example.marketdata.model.ProviderId;
import com.example.marketdata.model.StreamState;
import com.example.marketdata.model.Timeframe;
import com.example.marketdata.provider.MarketDataProvider;
import com.example.marketdata.stream.TradeStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class TradeFeedServiceTest {

    private StubProvider provider;
    private TradeFeedService service;

    @BeforeEach
    void setUp() {
        provider = new StubProvider();
        service = new TradeFeedService(provider);
    }

    private static MarketData trade(String symbol, String price) {
        return MarketData.builder()
            .symbol(symbol)
            .timestamp(Instant.parse("2024-01-02T14:30:00Z"))
            .close(new BigDecimal(price))
            .volume(100)
            .provider("stub")
            .build();
    }

    @Test
    @DisplayName("idle until started")
    void idle() {
        assertEquals(StreamState.DISCONNECTED, service.getState());
        assertFalse(service.stop());
        assertEquals(Optional.empty(), service.getLatestTrade("AAPL"));
    }

    @Test
    @DisplayName("trades update the latest-trade cache and reach every callback")
    void fanOut() {
        List<MarketData> first = new ArrayList<>();
        List<MarketData> second = new ArrayList<>();
        service.registerCallback(first::add);
        service.registerCallback(second::add);

        service.start(List.of("AAPL", "TSLA"));
        provider.lastStream.emit(trade("AAPL", "185.10"));
        provider.lastStream.emit(trade("AAPL", "185.20"));
        provider.lastStream.emit(trade("TSLA", "248.00"));

        assertEquals(3, first.size());
        assertEquals(3, second.size());
        assertEquals(0, new BigDecimal("185.20").compareTo(service.getLatestTrade("aapl").get().getClose()));
        assertEquals(StreamState.STREAMING, service.getState());
    }

    @Test
    @DisplayName("latest-trade lookup ignores the default locale")
    void lookupUnderTurkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            service.start(List.of("INTC"));
            provider.lastStream.emit(trade("INTC", "47.50"));

            assertTrue(service.getLatestTrade("intc").isPresent());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("a throwing callback does not stop the others")
    void callbackFailureIsolated() {
        List<MarketData> received = new ArrayList<>();
        service.registerCallback(trade -> {
            throw new IllegalStateException("boom");
        });
        service.registerCallback(received::add);

        service.start(List.of("AAPL"));
        provider.lastStream.emit(trade("AAPL", "185.10"));

        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("starting again replaces the running stream")
    void restartReplaces() {
        service.start(List.of("AAPL"));
        StubStream first = provider.lastStream;

        service.start(List.of("MSFT"));

        assertEquals(StreamState.CLOSED, first.state());
        assertEquals(StreamState.STREAMING, service.getState());
        assertEquals(List.of("MSFT"), service.getStatus().get("symbols"));
    }

    @Test
    @DisplayName("stop cancels the stream and reports it")
    void stop() {
        service.start(List.of("AAPL"));

        assertTrue(service.stop());
        assertEquals(StreamState.CLOSED, service.getState());
        assertFalse(service.stop());
    }

    @Test
    @DisplayName("status exposes provider, state and symbols")
    void status() {
        service.start(List.of("AAPL"));

        Map<String, Object> status = service.getStatus();

        assertEquals("alpaca", status.get("provider"));
        assertEquals(StreamState.STREAMING, status.get("state"));
        assertEquals(List.of("AAPL"), status.get("symbols"));
    }

    static final class StubStream implements TradeStream {

        private final List<String> symbols;
        private final Consumer<MarketData> sink;
        private volatile StreamState state = StreamState.STREAMING;

        StubStream(List<String> symbols, Consumer<MarketData> sink) {
            this.symbols = symbols;
            this.sink = sink;
        }

        void emit(MarketData trade) {
            if (state == StreamState.STREAMING) {
                sink.accept(trade);
            }
        }

        @Override
        public StreamState state() {
            return state;
        }

        @Override
        public List<String> symbols() {
            return symbols;
        }

        @Override
        public void cancel() {
            state = StreamState.CLOSED;
        }

        @Override
        public void await() {
        }

        @Override
        public boolean await(Duration timeout) {
            return state.isTerminal();
        }

        @Override
        public Optional<Throwable> failure() {
            return Optional.empty();
        }
    }

    static final class StubProvider implements MarketDataProvider {

        StubStream lastStream;

        @Override
        public ProviderId id() {
            return ProviderId.ALPACA;
        }

        @Override
        public Set<Capability> capabilities() {
            return EnumSet.of(Capability.TRADE_STREAM);
        }

        @Override
        public MarketDataProvider open() {
            return this;
        }

        @Override
        public boolean isOpen() {
            return true;
        }

        @Override
        public List<MarketData> fetchBars(String symbol, Instant start, Instant end, Timeframe timeframe) {
            throw new UnsupportedOperationException();
        }

        @Override
        public MarketData fetchLatestQuote(String symbol) {
            throw new UnsupportedOperationException();
        }

        @Override
        public TradeStream streamTrades(List<String> symbols, Consumer<MarketData> sink) {
            lastStream = new StubStream(symbols, sink);
            return lastStream;
        }

        @Override
        public List<OptionsQuote> fetchOptionsChain(String symbol, LocalDate expiration) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void close() {
        }
    }
}
