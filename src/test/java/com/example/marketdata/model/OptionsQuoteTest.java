package com.example.marketdata.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OptionsQuoteTest {

    private static OptionsQuote.OptionsQuoteBuilder contract() {
        return OptionsQuote.builder()
            .underlying("AAPL")
            .contractSymbol("AAPL240119C00150000")
            .timestamp(Instant.parse("2024-01-02T15:00:00Z"))
            .strike(new BigDecimal("150"))
            .expiration(Instant.parse("2024-01-19T21:00:00Z"))
            .optionType(OptionType.CALL)
            .bid(new BigDecimal("35.10"))
            .ask(new BigDecimal("35.50"))
            .volume(120)
            .openInterest(4500);
    }

    @Test
    @DisplayName("mid price and spread from bid/ask")
    void midAndSpread() {
        OptionsQuote quote = contract().build();

        assertEquals(0, new BigDecimal("35.30").compareTo(quote.getMidPrice()));
        assertEquals(0, new BigDecimal("0.40").compareTo(quote.getSpread()));
        assertEquals(BigDecimal.ZERO, quote.getLast());
        assertNull(quote.getGreeks());
        assertNull(quote.getImpliedVolatility());
    }

    @Test
    @DisplayName("bid above ask is rejected")
    void crossedMarket() {
        assertThrows(IllegalArgumentException.class,
            () -> contract().bid(new BigDecimal("36")).ask(new BigDecimal("35")).build());
    }

    @Test
    @DisplayName("bid without an ask is kept, the missing side reads as zero")
    void oneSidedQuote() {
        OptionsQuote quote = contract().ask(null).build();

        assertEquals(0, new BigDecimal("35.10").compareTo(quote.getBid()));
        assertEquals(BigDecimal.ZERO, quote.getAsk());
    }

    @Test
    @DisplayName("strike must be positive")
    void zeroStrike() {
        assertThrows(IllegalArgumentException.class, () -> contract().strike(BigDecimal.ZERO).build());
    }

    @Test
    @DisplayName("negative open interest is rejected")
    void negativeOpenInterest() {
        assertThrows(IllegalArgumentException.class, () -> contract().openInterest(-1).build());
    }

    @Test
    @DisplayName("greeks keep null as not computed")
    void partialGreeks() {
        Greeks greeks = Greeks.builder().delta(0.62).theta(-0.05).build();

        assertFalse(greeks.isEmpty());
        assertEquals(Map.of("delta", 0.62, "theta", -0.05), greeks.asMap());
        assertNull(greeks.getGamma());
        assertTrue(Greeks.builder().build().isEmpty());
    }
}
