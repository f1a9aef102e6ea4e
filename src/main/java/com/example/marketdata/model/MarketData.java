package com.example.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Canonical bar / trade / quote record produced by every provider.
 *
 * Quote- and trade-derived records carry zero OHL (and zero volume for quotes).
 * Consumers must read those zeros as "not applicable", never as real prices;
 * see {@link #isQuoteDerived()}.
 */
@Value
public class MarketData implements Serializable {

    private static final long serialVersionUID = 1L;

    String symbol;
    Instant timestamp;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    long volume;
    BigDecimal vwap;        // optional
    Long tradeCount;        // optional
    String provider;        // alpaca, etrade, ...

    @Builder(toBuilder = true)
    private MarketData(String symbol,
                       Instant timestamp,
                       BigDecimal open,
                       BigDecimal high,
                       BigDecimal low,
                       BigDecimal close,
                       long volume,
                       BigDecimal vwap,
                       Long tradeCount,
                       String provider) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.open = open != null ? open : BigDecimal.ZERO;
        this.high = high != null ? high : BigDecimal.ZERO;
        this.low = low != null ? low : BigDecimal.ZERO;
        this.close = Objects.requireNonNull(close, "close");
        this.volume = volume;
        this.vwap = vwap;
        this.tradeCount = tradeCount;
        this.provider = provider;

        if (this.high.compareTo(this.low) < 0) {
            throw new IllegalArgumentException(
                "High (" + this.high + ") cannot be less than low (" + this.low + ") for " + symbol);
        }
        if (this.open.signum() < 0 || this.high.signum() < 0
                || this.low.signum() < 0 || this.close.signum() < 0) {
            throw new IllegalArgumentException("Prices cannot be negative for " + symbol);
        }
        if (volume < 0) {
            throw new IllegalArgumentException("Volume cannot be negative for " + symbol);
        }
        if (tradeCount != null && tradeCount < 0) {
            throw new IllegalArgumentException("Trade count cannot be negative for " + symbol);
        }
    }

    /**
     * True when open, high and low are zero-filled, i.e. the record came from a
     * quote or a single trade tick rather than an interval bar.
     */
    @JsonIgnore
    public boolean isQuoteDerived() {
        return open.signum() == 0 && high.signum() == 0 && low.signum() == 0;
    }
}
