package com.example.marketdata.quality;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class QualityIssue {

    Severity severity;
    IssueType type;
    String symbol;
    Instant timestamp;
    String description;

    @Singular
    Map<String, Object> details;
}
