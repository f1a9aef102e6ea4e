package com.example.marketdata.config;

import com.example.marketdata.model.ProviderCredential;
import com.example.marketdata.model.ProviderId;
import com.example.marketdata.provider.MarketDataProvider;
import com.example.marketdata.provider.MarketDataProviderFactory;
import com.example.marketdata.provider.alpaca.AlpacaSettings;
import com.example.marketdata.quality.BarQualityChecker;
import com.example.marketdata.quality.QualitySettings;
import com.example.marketdata.stream.StreamSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
public class MarketDataConfig {

    @Value("${market-data.provider:alpaca}")
    private String providerId;

    @Value("${market-data.alpaca.api-key:}")
    private String alpacaApiKey;

    @Value("${market-data.alpaca.api-secret:}")
    private String alpacaApiSecret;

    @Value("${market-data.alpaca.data-url:https://data.alpaca.markets}")
    private String alpacaDataUrl;

    @Value("${market-data.alpaca.stream-url:wss://stream.data.alpaca.markets/v2}")
    private String alpacaStreamUrl;

    @Value("${market-data.alpaca.feed:iex}")
    private String alpacaFeed;

    @Value("${market-data.alpaca.options-feed:indicative}")
    private String alpacaOptionsFeed;

    @Value("${market-data.alpaca.connect-timeout-ms:10000}")
    private long alpacaConnectTimeoutMs;

    @Value("${market-data.alpaca.request-timeout-ms:10000}")
    private long alpacaRequestTimeoutMs;

    @Value("${market-data.etrade.api-key:}")
    private String etradeApiKey;

    @Value("${market-data.etrade.api-secret:}")
    private String etradeApiSecret;

    @Value("${market-data.stream.handshake-timeout-ms:10000}")
    private long handshakeTimeoutMs;

    @Value("${market-data.stream.poll-interval-ms:250}")
    private long pollIntervalMs;

    @Value("${market-data.stream.shutdown-timeout-ms:5000}")
    private long shutdownTimeoutMs;

    @Value("${market-data.quality.stale-after-ms:3600000}")
    private long staleAfterMs;

    @Value("${market-data.quality.outlier-z:5.0}")
    private double outlierZ;

    @Value("${market-data.quality.volume-multiplier:3.0}")
    private double volumeMultiplier;

    @Bean
    @Primary
    public ObjectMapper marketDataObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock marketDataClock() {
        return Clock.systemUTC();
    }

    @Bean
    public AlpacaSettings alpacaSettings() {
        return AlpacaSettings.builder()
            .dataUrl(alpacaDataUrl)
            .streamUrl(alpacaStreamUrl)
            .feed(alpacaFeed)
            .optionsFeed(alpacaOptionsFeed)
            .connectTimeout(Duration.ofMillis(alpacaConnectTimeoutMs))
            .requestTimeout(Duration.ofMillis(alpacaRequestTimeoutMs))
            .build();
    }

    @Bean
    public StreamSettings streamSettings() {
        return StreamSettings.builder()
            .handshakeTimeout(Duration.ofMillis(handshakeTimeoutMs))
            .pollInterval(Duration.ofMillis(pollIntervalMs))
            .shutdownTimeout(Duration.ofMillis(shutdownTimeoutMs))
            .build();
    }

    @Bean
    public MarketDataProviderFactory marketDataProviderFactory(AlpacaSettings alpacaSettings,
                                                               StreamSettings streamSettings,
                                                               ObjectMapper marketDataObjectMapper,
                                                               Clock marketDataClock) {
        return new MarketDataProviderFactory(alpacaSettings, streamSettings, marketDataObjectMapper,
            null, marketDataClock);
    }

    /**
     * The configured provider, opened at startup and closed on shutdown.
     */
    @Bean(destroyMethod = "close")
    public MarketDataProvider marketDataProvider(MarketDataProviderFactory factory) {
        log.info("Market data provider: {}", providerId);
        MarketDataProvider provider = factory.createProvider(providerId, credentialFor(providerId));
        return provider.open();
    }

    @Bean
    public BarQualityChecker barQualityChecker(Clock marketDataClock) {
        QualitySettings settings = QualitySettings.builder()
            .staleAfter(Duration.ofMillis(staleAfterMs))
            .outlierZ(outlierZ)
            .volumeMultiplier(volumeMultiplier)
            .build();
        return new BarQualityChecker(settings, marketDataClock);
    }

    private ProviderCredential credentialFor(String id) {
        ProviderId provider = ProviderId.fromId(id).orElse(null);
        if (provider == ProviderId.ALPACA) {
            return ProviderCredential.of(blankToNull(alpacaApiKey), blankToNull(alpacaApiSecret));
        }
        if (provider == ProviderId.ETRADE) {
            return ProviderCredential.of(blankToNull(etradeApiKey), blankToNull(etradeApiSecret));
        }
        return ProviderCredential.of(null, null);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
