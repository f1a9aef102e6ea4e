package com.example.marketdata.model;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Bar intervals. Canonical codes follow the pipeline's own notation
 * ("1Min", "1H", "1D"); {@link #vendorCode()} is what the Alpaca data API expects.
 */
public enum Timeframe {
    ONE_MIN("1Min", "1Min", Duration.ofMinutes(1)),
    FIVE_MIN("5Min", "5Min", Duration.ofMinutes(5)),
    FIFTEEN_MIN("15Min", "15Min", Duration.ofMinutes(15)),
    THIRTY_MIN("30Min", "30Min", Duration.ofMinutes(30)),
    ONE_HOUR("1H", "1Hour", Duration.ofHours(1)),
    FOUR_HOUR("4H", "4Hour", Duration.ofHours(4)),
    ONE_DAY("1D", "1Day", Duration.ofDays(1)),
    ONE_WEEK("1W", "1Week", Duration.ofDays(7)),
    ONE_MONTH("1M", "1Month", Duration.ofDays(30));

    // lower-cased alias -> timeframe; "1m" stays minutes, "1M" is handled before lower-casing
    private static final Map<String, Timeframe> ALIASES = Map.ofEntries(
        Map.entry("1min", ONE_MIN), Map.entry("1m", ONE_MIN), Map.entry("1t", ONE_MIN),
        Map.entry("5min", FIVE_MIN), Map.entry("5m", FIVE_MIN),
        Map.entry("15min", FIFTEEN_MIN), Map.entry("15m", FIFTEEN_MIN),
        Map.entry("30min", THIRTY_MIN), Map.entry("30m", THIRTY_MIN),
        Map.entry("1h", ONE_HOUR), Map.entry("1hour", ONE_HOUR),
        Map.entry("4h", FOUR_HOUR), Map.entry("4hour", FOUR_HOUR),
        Map.entry("1d", ONE_DAY), Map.entry("1day", ONE_DAY),
        Map.entry("1w", ONE_WEEK), Map.entry("1week", ONE_WEEK),
        Map.entry("1month", ONE_MONTH), Map.entry("1mo", ONE_MONTH)
    );

    private final String code;
    private final String vendorCode;
    private final Duration duration;

    Timeframe(String code, String vendorCode, Duration duration) {
        this.code = code;
        this.vendorCode = vendorCode;
        this.duration = duration;
    }

    public String code() {
        return code;
    }

    public String vendorCode() {
        return vendorCode;
    }

    /**
     * Nominal length of one bar. Months are treated as 30 days.
     */
    public Duration duration() {
        return duration;
    }

    public static Timeframe parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Timeframe must not be empty");
        }
        String trimmed = value.trim();
        if ("1M".equals(trimmed)) {
            return ONE_MONTH;
        }
        Timeframe timeframe = ALIASES.get(trimmed.toLowerCase(Locale.ROOT));
        if (timeframe == null) {
            throw new IllegalArgumentException("Unsupported timeframe: " + value);
        }
        return timeframe;
    }
}
