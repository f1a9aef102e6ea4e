package com.example.marketdata.controller;

import com.example.marketdata.config.MarketDataConfig;
import com.example.marketdata.exception.AuthenticationFailedException;
import com.example.marketdata.exception.ProviderNotImplementedException;
import com.example.marketdata.exception.TransportException;
import com.example.marketdata.model.Capability;
import com.example.marketdata.model.MarketData;
import com.example.marketdata.model.OptionsQuote;
import com.example.marketdata.model.ProviderId;
import com.example.marketdata.model.StreamState;
import com.example.marketdata.model.Timeframe;
import com.example.marketdata.provider.MarketDataProvider;
import com.example.marketdata.quality.BarQualityChecker;
import com.example.marketdata.quality.QualitySettings;
import com.example.marketdata.service.MarketDataQueryService;
import com.example.marketdata.service.TradeFeedService;
import com.example.marketdata.stream.TradeStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MarketDataControllerTest {

    private static final Instant NOW = Instant.parse("2024-01-05T00:00:00Z");

    private ScriptedProvider provider;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        provider = new ScriptedProvider();
        BarQualityChecker checker = new BarQualityChecker(QualitySettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
        MarketDataController controller = new MarketDataController(
            new MarketDataQueryService(provider, checker), new TradeFeedService(provider));

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new MarketDataExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(new MarketDataConfig().marketDataObjectMapper()))
            .build();
    }

    @Test
    @DisplayName("GET /capabilities lists provider and capabilities")
    void capabilities() throws Exception {
        mockMvc.perform(get("/api/market-data/capabilities"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.provider").value("alpaca"))
            .andExpect(jsonPath("$.capabilities", hasSize(3)));
    }

    @Nested
    @DisplayName("GET /bars/{symbol}")
    class Bars {

        @Test
        @DisplayName("returns bars with ISO timestamps")
        void bars() throws Exception {
            mockMvc.perform(get("/api/market-data/bars/AAPL")
                    .param("start", "2024-01-01T00:00:00Z")
                    .param("end", "2024-01-05T00:00:00Z")
                    .param("timeframe", "1Day"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.symbol").value("AAPL"))
                .andExpect(jsonPath("$.timeframe").value("1D"))
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.bars[0].timestamp").value("2024-01-02T05:00:00Z"))
                .andExpect(jsonPath("$.bars[0].provider").value("alpaca"));
        }

        @Test
        @DisplayName("unknown timeframe is a bad request")
        void badTimeframe() throws Exception {
            mockMvc.perform(get("/api/market-data/bars/AAPL")
                    .param("start", "2024-01-01T00:00:00Z")
                    .param("end", "2024-01-05T00:00:00Z")
                    .param("timeframe", "7X"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));
        }

        @Test
        @DisplayName("unparseable or missing timestamps are bad requests")
        void badTimestamps() throws Exception {
            mockMvc.perform(get("/api/market-data/bars/AAPL")
                    .param("start", "yesterday")
                    .param("end", "2024-01-05T00:00:00Z"))
                .andExpect(status().isBadRequest());
            mockMvc.perform(get("/api/market-data/bars/AAPL")
                    .param("end", "2024-01-05T00:00:00Z"))
                .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("upstream HTTP failure is a 502 carrying the upstream status")
        void transportFailure() throws Exception {
            mockMvc.perform(get("/api/market-data/bars/FAIL")
                    .param("start", "2024-01-01T00:00:00Z")
                    .param("end", "2024-01-05T00:00:00Z"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("transport_failure"))
                .andExpect(jsonPath("$.upstreamStatus").value(500))
                .andExpect(jsonPath("$.vendor").value("alpaca"));
        }
    }

    @Test
    @DisplayName("GET /quote/{symbol} returns the midpoint record")
    void quote() throws Exception {
        mockMvc.perform(get("/api/market-data/quote/AAPL"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.close").value(181.91))
            .andExpect(jsonPath("$.open").value(0));
    }

    @Test
    @DisplayName("authentication failure is a 502")
    void authenticationFailure() throws Exception {
        mockMvc.perform(get("/api/market-data/quote/DENIED"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("authentication_failed"));
    }

    @Test
    @DisplayName("not implemented capability is a 501")
    void notImplemented() throws Exception {
        mockMvc.perform(get("/api/market-data/options/AAPL").param("expiration", "2024-01-19"))
            .andExpect(status().isNotImplemented())
            .andExpect(jsonPath("$.error").value("unsupported"))
            .andExpect(jsonPath("$.operation").value("fetchOptionsChain"));
    }

    @Test
    @DisplayName("GET /quality/{symbol} reports issues in the fetched bars")
    void quality() throws Exception {
        mockMvc.perform(get("/api/market-data/quality/AAPL")
                .param("start", "2024-01-01T00:00:00Z")
                .param("end", "2024-01-05T00:00:00Z"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.clean").value(false))
            .andExpect(jsonPath("$.summary.WARNING").value(1))
            .andExpect(jsonPath("$.report", containsString("stale_data")));
    }

    @Nested
    @DisplayName("stream endpoints")
    class Stream {

        @Test
        @DisplayName("POST starts, GET reports, DELETE stops")
        void lifecycle() throws Exception {
            mockMvc.perform(post("/api/market-data/stream")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"symbols\":[\"AAPL\",\"TSLA\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("STREAMING"))
                .andExpect(jsonPath("$.symbols", hasSize(2)));

            mockMvc.perform(get("/api/market-data/stream"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("STREAMING"));

            mockMvc.perform(delete("/api/market-data/stream"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stopped").value(true))
                .andExpect(jsonPath("$.state").value("CLOSED"));
        }

        @Test
        @DisplayName("POST without symbols is a bad request")
        void missingSymbols() throws Exception {
            mockMvc.perform(post("/api/market-data/stream")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"symbols\":[]}"))
                .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("latest trade is 404 until one arrives")
        void latestTrade() throws Exception {
            mockMvc.perform(get("/api/market-data/trades/AAPL/latest"))
                .andExpect(status().isNotFound());

            mockMvc.perform(post("/api/market-data/stream")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"symbols\":[\"AAPL\"]}"))
                .andExpect(status().isOk());
            provider.sink.accept(MarketData.builder()
                .symbol("AAPL")
                .timestamp(Instant.parse("2024-01-04T20:59:59Z"))
                .close(new BigDecimal("181.91"))
                .volume(100)
                .provider("alpaca")
                .build());

            mockMvc.perform(get("/api/market-data/trades/aapl/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.symbol").value("AAPL"))
                .andExpect(jsonPath("$.volume").value(100));
        }
    }

    /**
     * Bars and quotes for any symbol; FAIL and DENIED trigger failures; options are not implemented.
     */
    static final class ScriptedProvider implements MarketDataProvider {

        volatile Consumer<MarketData> sink;

        @Override
        public ProviderId id() {
            return ProviderId.ALPACA;
        }

        @Override
        public Set<Capability> capabilities() {
            return EnumSet.of(Capability.HISTORICAL_BARS, Capability.LATEST_QUOTE, Capability.TRADE_STREAM);
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
            if ("FAIL".equals(symbol)) {
                throw new TransportException("alpaca", "fetchBars", symbol, 500, "internal error");
            }
            return List.of(
                bar(symbol, "2024-01-02T05:00:00Z", "185.64"),
                bar(symbol, "2024-01-03T05:00:00Z", "184.25"));
        }

        @Override
        public MarketData fetchLatestQuote(String symbol) {
            if ("DENIED".equals(symbol)) {
                throw new AuthenticationFailedException("alpaca", "fetchLatestQuote", symbol, "rejected");
            }
            return MarketData.builder()
                .symbol(symbol)
                .timestamp(Instant.parse("2024-01-04T20:59:59Z"))
                .close(new BigDecimal("181.91"))
                .provider("alpaca")
                .build();
        }

        @Override
        public TradeStream streamTrades(List<String> symbols, Consumer<MarketData> sink) {
            this.sink = sink;
            return new TradeStream() {
                private volatile StreamState state = StreamState.STREAMING;

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
            };
        }

        @Override
        public List<OptionsQuote> fetchOptionsChain(String symbol, LocalDate expiration) {
            throw new ProviderNotImplementedException("alpaca", Capability.OPTIONS_CHAIN, symbol, "not built");
        }

        @Override
        public void close() {
        }

        private static MarketData bar(String symbol, String time, String close) {
            BigDecimal c = new BigDecimal(close);
            return MarketData.builder()
                .symbol(symbol)
                .timestamp(Instant.parse(time))
                .open(c)
                .high(c)
                .low(c)
                .close(c)
                .volume(1_000)
                .provider("alpaca")
                .build();
        }
    }
}
