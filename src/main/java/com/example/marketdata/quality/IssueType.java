package com.example.marketdata.quality;

public enum IssueType {
    NO_DATA("no_data"),
    MISSING_BARS("missing_bars"),
    STALE_DATA("stale_data"),
    PRICE_OUTLIER("price_outlier"),
    VOLUME_ANOMALY("volume_anomaly");

    private final String code;

    IssueType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
