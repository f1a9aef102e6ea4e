package com.example.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One contract of an options chain.
 */
@Value
public class OptionsQuote implements Serializable {

    private static final long serialVersionUID = 1L;

    String underlying;
    String contractSymbol;  // OCC, e.g. AAPL240119C00150000
    Instant timestamp;
    BigDecimal strike;
    Instant expiration;
    OptionType optionType;
    BigDecimal bid;
    BigDecimal ask;
    BigDecimal last;
    long volume;
    long openInterest;
    Double impliedVolatility;   // null when the vendor did not compute it
    Greeks greeks;              // null when the vendor did not compute any

    @Builder(toBuilder = true)
    private OptionsQuote(String underlying,
                         String contractSymbol,
                         Instant timestamp,
                         BigDecimal strike,
                         Instant expiration,
                         OptionType optionType,
                         BigDecimal bid,
                         BigDecimal ask,
                         BigDecimal last,
                         long volume,
                         long openInterest,
                         Double impliedVolatility,
                         Greeks greeks) {
        this.underlying = Objects.requireNonNull(underlying, "underlying");
        this.contractSymbol = Objects.requireNonNull(contractSymbol, "contractSymbol");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.strike = Objects.requireNonNull(strike, "strike");
        this.expiration = Objects.requireNonNull(expiration, "expiration");
        this.optionType = Objects.requireNonNull(optionType, "optionType");
        this.bid = bid != null ? bid : BigDecimal.ZERO;
        this.ask = ask != null ? ask : BigDecimal.ZERO;
        this.last = last != null ? last : BigDecimal.ZERO;
        this.volume = volume;
        this.openInterest = openInterest;
        this.impliedVolatility = impliedVolatility;
        this.greeks = greeks;

        if (strike.signum() <= 0) {
            throw new IllegalArgumentException("Strike price must be positive: " + contractSymbol);
        }
        // one-sided quotes keep the missing side at zero and skip the crossed check
        if (bid != null && ask != null && bid.compareTo(ask) > 0) {
            throw new IllegalArgumentException(
                "Bid (" + this.bid + ") cannot exceed ask (" + this.ask + ") for " + contractSymbol);
        }
        if (this.bid.signum() < 0 || this.ask.signum() < 0 || this.last.signum() < 0) {
            throw new IllegalArgumentException("Prices cannot be negative: " + contractSymbol);
        }
        if (volume < 0 || openInterest < 0) {
            throw new IllegalArgumentException("Volume and open interest cannot be negative: " + contractSymbol);
        }
    }

    @JsonIgnore
    public BigDecimal getMidPrice() {
        return bid.add(ask).divide(BigDecimal.valueOf(2));
    }

    @JsonIgnore
    public BigDecimal getSpread() {
        return ask.subtract(bid);
    }
}
