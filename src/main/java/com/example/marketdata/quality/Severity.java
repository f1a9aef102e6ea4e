package com.example.marketdata.quality;

public enum Severity {
    CRITICAL,
    WARNING,
    INFO
}
