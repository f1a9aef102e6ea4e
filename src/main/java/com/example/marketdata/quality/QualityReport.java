package com.example.marketdata.quality;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Issues found per symbol. Symbols without issues are absent.
 */
@Value
public class QualityReport {

    Instant generatedAt;
    int symbolsChecked;
    Map<String, List<QualityIssue>> issues;

    public QualityReport(Instant generatedAt, int symbolsChecked, Map<String, List<QualityIssue>> issues) {
        this.generatedAt = generatedAt;
        this.symbolsChecked = symbolsChecked;
        this.issues = Collections.unmodifiableMap(new TreeMap<>(issues));
    }

    public Map<Severity, Integer> countBySeverity() {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (List<QualityIssue> symbolIssues : issues.values()) {
            for (QualityIssue issue : symbolIssues) {
                counts.merge(issue.getSeverity(), 1, Integer::sum);
            }
        }
        return counts;
    }

    public boolean isClean() {
        return issues.isEmpty();
    }

    /**
     * Markdown summary by severity followed by the issues of each symbol.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("# Market Data Quality Report\n\n");
        sb.append("Generated: ").append(generatedAt).append('\n');
        sb.append("Symbols checked: ").append(symbolsChecked).append('\n');
        sb.append("Symbols with issues: ").append(issues.size()).append("\n\n");

        sb.append("## Summary\n");
        Map<Severity, Integer> counts = countBySeverity();
        if (counts.isEmpty()) {
            sb.append("- No issues\n");
        }
        counts.forEach((severity, count) -> sb.append("- ").append(severity).append(": ").append(count).append('\n'));

        sb.append("\n## Details\n");
        issues.forEach((symbol, symbolIssues) -> {
            sb.append("\n### ").append(symbol).append('\n');
            for (QualityIssue issue : symbolIssues) {
                sb.append("- [").append(issue.getSeverity()).append("] ")
                    .append(issue.getType().code()).append(": ")
                    .append(issue.getDescription()).append('\n');
            }
        });
        return sb.toString();
    }
}
