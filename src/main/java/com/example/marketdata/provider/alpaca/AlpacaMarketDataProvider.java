package com.example.marketdata.provider.alpaca;

import com.example.marketdata.exception.AuthenticationFailedException;
import com.example.marketdata.exception.TransportException;
import com.example.marketdata.model.Capability;
import com.example.marketdata.model.Greeks;
import com.example.marketdata.model.MarketData;
import com.example.marketdata.model.OptionsQuote;
import com.example.marketdata.model.ProviderCredential;
import com.example.marketdata.model.ProviderId;
import com.example.marketdata.model.Timeframe;
import com.example.marketdata.provider.MarketDataProvider;
import com.example.marketdata.provider.ProviderSession;
import com.example.marketdata.stream.JdkWebSocketConnector;
import com.example.marketdata.stream.StreamConnector;
import com.example.marketdata.stream.StreamSettings;
import com.example.marketdata.stream.TradeStream;
import com.example.marketdata.stream.TradeStreamSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Alpaca market data provider.
 * Historical bars, latest quotes and options snapshots via the REST data API;
 * real-time trades via the streaming API.
 *
 * Bars and quotes fail hard on any transport error. The options chain treats
 * 404 (no options for the symbol) and 403 (subscription tier lacks options) as
 * an empty chain; every other failure is thrown like bars and quotes.
 */
@Slf4j
public class AlpacaMarketDataProvider implements MarketDataProvider {

    private static final String VENDOR = AlpacaStreamProtocol.VENDOR;
    private static final Set<Capability> CAPABILITIES =
        Collections.unmodifiableSet(EnumSet.allOf(Capability.class));
    private static final int MAX_ERROR_BODY = 300;

    private final AlpacaSettings settings;
    private final StreamSettings streamSettings;
    private final ProviderCredential credential;
    private final ObjectMapper objectMapper;
    private final AlpacaStreamProtocol streamProtocol;
    private final StreamConnector streamConnector;
    private final Clock clock;

    private volatile ProviderSession session;

    public AlpacaMarketDataProvider(AlpacaSettings settings,
                                    StreamSettings streamSettings,
                                    ProviderCredential credential,
                                    ObjectMapper objectMapper) {
        this(settings, streamSettings, credential, objectMapper, null, Clock.systemUTC());
    }

    /**
     * @param streamConnector connector for trade streams; null to use the JDK WebSocket
     *                        client of this provider's session
     */
    public AlpacaMarketDataProvider(AlpacaSettings settings,
                                    StreamSettings streamSettings,
                                    ProviderCredential credential,
                                    ObjectMapper objectMapper,
                                    StreamConnector streamConnector,
                                    Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.streamSettings = Objects.requireNonNull(streamSettings, "streamSettings");
        this.credential = Objects.requireNonNull(credential, "credential");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.streamProtocol = new AlpacaStreamProtocol(objectMapper);
        this.streamConnector = streamConnector;
        this.clock = clock;
    }

    @Override
    public ProviderId id() {
        return ProviderId.ALPACA;
    }

    @Override
    public Set<Capability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public synchronized MarketDataProvider open() {
        if (session != null && session.isOpen()) {
            return this;
        }
        if (!credential.isConfigured()) {
            log.warn("Alpaca API credentials not configured. Requests will be rejected.");
        }
        session = ProviderSession.open(VENDOR, settings.getConnectTimeout());
        log.info("Alpaca market data provider opened: data={}, stream={}/{}",
            settings.getDataUrl(), settings.getStreamUrl(), settings.getFeed());
        return this;
    }

    @Override
    public boolean isOpen() {
        ProviderSession current = session;
        return current != null && current.isOpen();
    }

    @Override
    public synchronized void close() {
        if (session != null) {
            session.close();
            log.info("Alpaca market data provider closed");
        }
    }

    // =========================================================================
    // Historical bars
    // =========================================================================

    @Override
    public List<MarketData> fetchBars(String symbol, Instant start, Instant end, Timeframe timeframe) {
        String normalized = normalizeSymbol(symbol);
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(timeframe, "timeframe");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }

        String url = settings.getDataUrl() + "/v2/stocks/" + encode(normalized) + "/bars"
            + "?start=" + encode(DateTimeFormatter.ISO_INSTANT.format(start))
            + "&end=" + encode(DateTimeFormatter.ISO_INSTANT.format(end))
            + "&timeframe=" + timeframe.vendorCode()
            + "&adjustment=all"
            + "&feed=" + settings.getFeed()
            + "&limit=" + settings.getBarLimit();

        JsonNode root = readBody("fetchBars", normalized, send("fetchBars", normalized, url));

        List<MarketData> bars = new ArrayList<>();
        JsonNode barArray = root.path("bars");
        if (barArray.isArray()) {
            for (JsonNode node : barArray) {
                MarketData bar;
                try {
                    bar = parseBar(normalized, node);
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping malformed bar for {}: {}", normalized, e.getMessage());
                    continue;
                }
                if (bar.getTimestamp().isBefore(start) || bar.getTimestamp().isAfter(end)) {
                    log.warn("Skipping bar for {} at {} outside [{}, {}]", normalized, bar.getTimestamp(), start, end);
                    continue;
                }
                bars.add(bar);
            }
        }
        bars.sort(Comparator.comparing(MarketData::getTimestamp));

        if (root.hasNonNull("next_page_token")) {
            log.debug("Alpaca returned more bars for {} than the limit of {}", normalized, settings.getBarLimit());
        }
        log.info("Fetched {} bars for {} from Alpaca", bars.size(), normalized);
        return Collections.unmodifiableList(bars);
    }

    private MarketData parseBar(String symbol, JsonNode node) {
        return MarketData.builder()
            .symbol(symbol)
            .timestamp(AlpacaJson.instant(node, "t"))
            .open(AlpacaJson.decimal(node, "o"))
            .high(AlpacaJson.decimal(node, "h"))
            .low(AlpacaJson.decimal(node, "l"))
            .close(AlpacaJson.decimal(node, "c"))
            .volume(AlpacaJson.wholeNumber(node, "v"))
            .vwap(AlpacaJson.optionalDecimal(node, "vw"))
            .tradeCount(AlpacaJson.optionalWholeNumber(node, "n"))
            .provider(VENDOR)
            .build();
    }

    // =========================================================================
    // Latest quote
    // =========================================================================

    @Override
    public MarketData fetchLatestQuote(String symbol) {
        String normalized = normalizeSymbol(symbol);
        String url = settings.getDataUrl() + "/v2/stocks/" + encode(normalized) + "/quotes/latest"
            + "?feed=" + settings.getFeed();

        JsonNode root = readBody("fetchLatestQuote", normalized, send("fetchLatestQuote", normalized, url));
        JsonNode quote = root.path("quote");
        if (!quote.isObject()) {
            throw new TransportException(VENDOR, "fetchLatestQuote", normalized, "Response has no quote");
        }

        try {
            BigDecimal bidPrice = AlpacaJson.decimal(quote, "bp");
            BigDecimal askPrice = AlpacaJson.decimal(quote, "ap");
            // Mid price
            BigDecimal midPrice = bidPrice.add(askPrice).divide(BigDecimal.valueOf(2));

            MarketData update = MarketData.builder()
                .symbol(normalized)
                .timestamp(AlpacaJson.instant(quote, "t"))
                .open(BigDecimal.ZERO)
                .high(BigDecimal.ZERO)
                .low(BigDecimal.ZERO)
                .close(midPrice)
                .volume(0)
                .provider(VENDOR)
                .build();
            log.debug("Quote: {} bid={} ask={}", normalized, bidPrice, askPrice);
            return update;
        } catch (IllegalArgumentException e) {
            throw new TransportException(VENDOR, "fetchLatestQuote", normalized,
                "Malformed quote: " + e.getMessage(), e);
        }
    }

    // =========================================================================
    // Trade streaming
    // =========================================================================

    @Override
    public TradeStream streamTrades(List<String> symbols, Consumer<MarketData> sink) {
        Objects.requireNonNull(symbols, "symbols");
        Objects.requireNonNull(sink, "sink");
        Set<String> normalized = new LinkedHashSet<>();
        for (String symbol : symbols) {
            normalized.add(normalizeSymbol(symbol));
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("At least one symbol is required");
        }

        ProviderSession current = requireSession();
        StreamConnector connector = streamConnector != null
            ? streamConnector
            : new JdkWebSocketConnector(current.httpClient());
        URI endpoint = URI.create(settings.getStreamUrl() + "/" + settings.getFeed());

        TradeStreamSession stream = new TradeStreamSession(VENDOR, endpoint, credential,
            streamProtocol, connector, current.executor(), streamSettings);
        current.register(stream);
        try {
            return stream.start(new ArrayList<>(normalized), sink);
        } catch (RuntimeException e) {
            current.unregister(stream);
            throw e;
        }
    }

    // =========================================================================
    // Options chain
    // =========================================================================

    @Override
    public List<OptionsQuote> fetchOptionsChain(String symbol, LocalDate expiration) {
        String normalized = normalizeSymbol(symbol);
        String baseUrl = settings.getDataUrl() + "/v1beta1/options/snapshots/" + encode(normalized)
            + "?feed=" + settings.getOptionsFeed()
            + "&limit=" + settings.getOptionsPageLimit()
            + (expiration != null ? "&expiration_date=" + expiration : "");

        List<OptionsQuote> options = new ArrayList<>();
        String pageToken = null;
        do {
            String url = pageToken == null ? baseUrl : baseUrl + "&page_token=" + encode(pageToken);
            HttpResponse<String> response = send("fetchOptionsChain", normalized, url);

            if (response.statusCode() == 404) {
                log.warn("Options data not available for {}", normalized);
                return Collections.unmodifiableList(options);
            }
            if (response.statusCode() == 403) {
                log.warn("Alpaca options data for {} requires an options data subscription", normalized);
                return Collections.unmodifiableList(options);
            }

            JsonNode root = readBody("fetchOptionsChain", normalized, response);
            JsonNode snapshots = root.path("snapshots");
            Iterator<Map.Entry<String, JsonNode>> fields = snapshots.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                try {
                    OptionsQuote quote = parseOptionSnapshot(normalized, entry.getKey(), entry.getValue());
                    if (expiration == null || expiration.equals(OccSymbol.parse(entry.getKey()).getExpirationDate())) {
                        options.add(quote);
                    }
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping malformed option snapshot {}: {}", entry.getKey(), e.getMessage());
                }
            }
            pageToken = root.hasNonNull("next_page_token") ? root.path("next_page_token").asText() : null;
        } while (pageToken != null && !pageToken.isEmpty());

        options.sort(Comparator.comparing(OptionsQuote::getExpiration)
            .thenComparing(OptionsQuote::getStrike)
            .thenComparing(OptionsQuote::getOptionType));
        log.info("Fetched {} option contracts for {} from Alpaca", options.size(), normalized);
        return Collections.unmodifiableList(options);
    }

    private OptionsQuote parseOptionSnapshot(String underlying, String contractSymbol, JsonNode snapshot) {
        OccSymbol occ = OccSymbol.parse(contractSymbol);
        JsonNode latestQuote = snapshot.path("latestQuote");
        JsonNode latestTrade = snapshot.path("latestTrade");
        JsonNode dailyBar = snapshot.path("dailyBar");

        Instant timestamp;
        if (latestQuote.has("t")) {
            timestamp = AlpacaJson.instant(latestQuote, "t");
        } else if (latestTrade.has("t")) {
            timestamp = AlpacaJson.instant(latestTrade, "t");
        } else {
            timestamp = clock.instant();
        }

        JsonNode greeksNode = snapshot.path("greeks");
        Greeks greeks = Greeks.builder()
            .delta(AlpacaJson.optionalDouble(greeksNode, "delta"))
            .gamma(AlpacaJson.optionalDouble(greeksNode, "gamma"))
            .theta(AlpacaJson.optionalDouble(greeksNode, "theta"))
            .vega(AlpacaJson.optionalDouble(greeksNode, "vega"))
            .rho(AlpacaJson.optionalDouble(greeksNode, "rho"))
            .build();

        Long volume = AlpacaJson.optionalWholeNumber(dailyBar, "v");
        Long openInterest = AlpacaJson.optionalWholeNumber(snapshot, "openInterest");

        return OptionsQuote.builder()
            .underlying(underlying)
            .contractSymbol(contractSymbol)
            .timestamp(timestamp)
            .strike(occ.getStrike())
            .expiration(occ.expirationInstant())
            .optionType(occ.getOptionType())
            .bid(AlpacaJson.optionalDecimal(latestQuote, "bp"))
            .ask(AlpacaJson.optionalDecimal(latestQuote, "ap"))
            .last(AlpacaJson.optionalDecimal(latestTrade, "p"))
            .volume(volume != null ? volume : 0L)
            .openInterest(openInterest != null ? openInterest : 0L)
            .impliedVolatility(AlpacaJson.optionalDouble(snapshot, "impliedVolatility"))
            .greeks(greeks.isEmpty() ? null : greeks)
            .build();
    }

    // =========================================================================
    // HTTP plumbing
    // =========================================================================

    private HttpResponse<String> send(String operation, String symbol, String url) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Accept", "application/json")
            .GET()
            .timeout(settings.getRequestTimeout());
        if (credential.getApiKey() != null) {
            builder.header("APCA-API-KEY-ID", credential.getApiKey());
        }
        if (credential.getApiSecret() != null) {
            builder.header("APCA-API-SECRET-KEY", credential.getApiSecret());
        }

        try {
            long startTime = System.currentTimeMillis();
            HttpResponse<String> response = requireSession().httpClient()
                .send(builder.build(), HttpResponse.BodyHandlers.ofString());
            log.debug("Alpaca {} for {} returned {} in {}ms",
                operation, symbol, response.statusCode(), System.currentTimeMillis() - startTime);
            return response;
        } catch (IOException e) {
            log.error("Error calling Alpaca {} for {}: {}", operation, symbol, e.getMessage());
            throw new TransportException(VENDOR, operation, symbol, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(VENDOR, operation, symbol, "Interrupted", e);
        }
    }

    private JsonNode readBody(String operation, String symbol, HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 401) {
            throw new AuthenticationFailedException(VENDOR, operation, symbol,
                "Alpaca rejected the API credentials");
        }
        if (status < 200 || status >= 300) {
            log.error("Alpaca {} for {} returned status {}", operation, symbol, status);
            throw new TransportException(VENDOR, operation, symbol, status, truncate(response.body()));
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new TransportException(VENDOR, operation, symbol, "Malformed response body", e);
        }
    }

    private ProviderSession requireSession() {
        ProviderSession current = session;
        if (current == null || !current.isOpen()) {
            throw new IllegalStateException("Alpaca provider is not open");
        }
        return current;
    }

    private static String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol must not be empty");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) + "..." : body;
    }
}
