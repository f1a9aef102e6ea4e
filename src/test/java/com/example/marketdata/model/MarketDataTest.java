package com.example.marketdata.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MarketDataTest {

    private static final Instant T = Instant.parse("2024-01-02T05:00:00Z");

    private static MarketData.MarketDataBuilder bar() {
        return MarketData.builder()
            .symbol("AAPL")
            .timestamp(T)
            .open(new BigDecimal("185.00"))
            .high(new BigDecimal("186.50"))
            .low(new BigDecimal("184.20"))
            .close(new BigDecimal("185.90"))
            .volume(1_000_000)
            .provider("alpaca");
    }

    @Nested
    @DisplayName("invariants")
    class Invariants {

        @Test
        @DisplayName("valid bar builds")
        void validBar() {
            MarketData data = bar().vwap(new BigDecimal("185.70")).tradeCount(12_000L).build();

            assertEquals("AAPL", data.getSymbol());
            assertFalse(data.isQuoteDerived());
            assertEquals(12_000L, data.getTradeCount());
        }

        @Test
        @DisplayName("high below low is rejected")
        void highBelowLow() {
            assertThrows(IllegalArgumentException.class,
                () -> bar().high(new BigDecimal("184.00")).low(new BigDecimal("184.20")).build());
        }

        @Test
        @DisplayName("negative price is rejected")
        void negativePrice() {
            assertThrows(IllegalArgumentException.class, () -> bar().close(new BigDecimal("-1")).build());
        }

        @Test
        @DisplayName("negative volume is rejected")
        void negativeVolume() {
            assertThrows(IllegalArgumentException.class, () -> bar().volume(-1).build());
        }

        @Test
        @DisplayName("negative trade count is rejected")
        void negativeTradeCount() {
            assertThrows(IllegalArgumentException.class, () -> bar().tradeCount(-5L).build());
        }

        @Test
        @DisplayName("symbol, timestamp and close are required")
        void requiredFields() {
            assertThrows(NullPointerException.class, () -> bar().symbol(null).build());
            assertThrows(NullPointerException.class, () -> bar().timestamp(null).build());
            assertThrows(NullPointerException.class, () -> bar().close(null).build());
        }
    }

    @Test
    @DisplayName("quote-shaped record: OHL default to zero and read as not applicable")
    void quoteDerived() {
        MarketData quote = MarketData.builder()
            .symbol("AAPL")
            .timestamp(T)
            .close(new BigDecimal("185.105"))
            .provider("alpaca")
            .build();

        assertEquals(BigDecimal.ZERO, quote.getOpen());
        assertEquals(BigDecimal.ZERO, quote.getHigh());
        assertEquals(BigDecimal.ZERO, quote.getLow());
        assertEquals(0, quote.getVolume());
        assertTrue(quote.isQuoteDerived());
    }
}
