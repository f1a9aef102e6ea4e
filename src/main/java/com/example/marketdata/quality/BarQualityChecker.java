package com.example.marketdata.quality;

import com.example.marketdata.model.MarketData;
import com.example.marketdata.model.Timeframe;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Quality checks over already-fetched bars: gaps, staleness, return outliers
 * and volume spikes. Stateless apart from its thresholds and clock.
 */
@Slf4j
public class BarQualityChecker {

    private final QualitySettings settings;
    private final Clock clock;

    public BarQualityChecker(QualitySettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * One NO_DATA issue when there are no bars, otherwise one MISSING_BARS issue per
     * gap wider than the tolerated multiple of the timeframe. Daily bars therefore
     * also report weekends and holidays.
     */
    public List<QualityIssue> checkMissingBars(String symbol, List<MarketData> bars, Timeframe timeframe) {
        List<QualityIssue> issues = new ArrayList<>();
        if (bars.isEmpty()) {
            issues.add(noData(symbol, "No data found for " + symbol + " in specified range"));
            return issues;
        }

        Duration expected = timeframe.duration();
        long toleratedMillis = (long) (expected.toMillis() * settings.getGapTolerance());
        List<MarketData> sorted = sorted(bars);
        for (int i = 1; i < sorted.size(); i++) {
            Instant previous = sorted.get(i - 1).getTimestamp();
            Instant current = sorted.get(i).getTimestamp();
            Duration gap = Duration.between(previous, current);
            if (gap.toMillis() > toleratedMillis) {
                issues.add(QualityIssue.builder()
                    .severity(Severity.WARNING)
                    .type(IssueType.MISSING_BARS)
                    .symbol(symbol)
                    .timestamp(current)
                    .description("Gap detected: " + gap)
                    .detail("expected", expected.toString())
                    .detail("actual", gap.toString())
                    .detail("previousBar", previous.toString())
                    .build());
            }
        }
        return issues;
    }

    public Optional<QualityIssue> checkStaleData(String symbol, List<MarketData> bars) {
        if (bars.isEmpty()) {
            return Optional.of(noData(symbol, "No data found for " + symbol));
        }

        Instant lastUpdate = bars.stream()
            .map(MarketData::getTimestamp)
            .max(Comparator.naturalOrder())
            .orElseThrow();
        Instant now = clock.instant();
        Duration age = Duration.between(lastUpdate, now);
        if (age.compareTo(settings.getStaleAfter()) > 0) {
            return Optional.of(QualityIssue.builder()
                .severity(Severity.WARNING)
                .type(IssueType.STALE_DATA)
                .symbol(symbol)
                .timestamp(now)
                .description("Data is " + age + " old (threshold: " + settings.getStaleAfter() + ")")
                .detail("lastUpdate", lastUpdate.toString())
                .detail("age", age.toString())
                .build());
        }
        return Optional.empty();
    }

    /**
     * Flags bars whose close-to-close return has a z-score beyond the threshold,
     * using the sample standard deviation of all returns in the series.
     */
    public List<QualityIssue> checkPriceOutliers(String symbol, List<MarketData> bars) {
        List<QualityIssue> issues = new ArrayList<>();
        if (bars.size() < settings.getMinBars()) {
            return issues;
        }

        List<MarketData> sorted = sorted(bars);
        List<MarketData> returnBars = new ArrayList<>();
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < sorted.size(); i++) {
            BigDecimal previousClose = sorted.get(i - 1).getClose();
            if (previousClose.signum() == 0) {
                continue;
            }
            BigDecimal change = sorted.get(i).getClose().subtract(previousClose)
                .divide(previousClose, MathContext.DECIMAL64);
            returns.add(change.doubleValue());
            returnBars.add(sorted.get(i));
        }
        if (returns.size() < 2) {
            return issues;
        }

        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double sumSquares = 0.0;
        for (double r : returns) {
            sumSquares += (r - mean) * (r - mean);
        }
        double std = Math.sqrt(sumSquares / (returns.size() - 1));
        if (std == 0.0 || Double.isNaN(std)) {
            return issues;
        }

        for (int i = 0; i < returns.size(); i++) {
            double r = returns.get(i);
            double z = (r - mean) / std;
            if (Math.abs(z) > settings.getOutlierZ()) {
                MarketData bar = returnBars.get(i);
                issues.add(QualityIssue.builder()
                    .severity(Severity.WARNING)
                    .type(IssueType.PRICE_OUTLIER)
                    .symbol(symbol)
                    .timestamp(bar.getTimestamp())
                    .description(String.format("Abnormal return: %.2f%% (z-score: %.2f)", r * 100, z))
                    .detail("close", bar.getClose())
                    .detail("return", r)
                    .detail("zScore", z)
                    .build());
            }
        }
        return issues;
    }

    /**
     * Flags bars whose volume exceeds the multiplier times the rolling mean of the
     * window ending at that bar. Bars before the first full window are not judged.
     */
    public List<QualityIssue> checkVolumeAnomalies(String symbol, List<MarketData> bars) {
        List<QualityIssue> issues = new ArrayList<>();
        if (bars.size() < settings.getMinBars()) {
            return issues;
        }

        List<MarketData> sorted = sorted(bars);
        int window = settings.getVolumeWindow();
        long windowSum = 0;
        for (int i = 0; i < sorted.size(); i++) {
            windowSum += sorted.get(i).getVolume();
            if (i >= window) {
                windowSum -= sorted.get(i - window).getVolume();
            }
            if (i < window - 1) {
                continue;
            }
            double average = (double) windowSum / window;
            if (average <= 0.0) {
                continue;
            }
            MarketData bar = sorted.get(i);
            double ratio = bar.getVolume() / average;
            if (ratio > settings.getVolumeMultiplier()) {
                issues.add(QualityIssue.builder()
                    .severity(Severity.INFO)
                    .type(IssueType.VOLUME_ANOMALY)
                    .symbol(symbol)
                    .timestamp(bar.getTimestamp())
                    .description(String.format("Volume %.1fx average", ratio))
                    .detail("volume", bar.getVolume())
                    .detail("avgVolume", (long) average)
                    .detail("ratio", ratio)
                    .build());
            }
        }
        return issues;
    }

    /**
     * Every check for one symbol. Critical issues are logged at ERROR, warnings at WARN.
     */
    public List<QualityIssue> checkSymbol(String symbol, List<MarketData> bars, Timeframe timeframe) {
        List<QualityIssue> issues = new ArrayList<>(checkMissingBars(symbol, bars, timeframe));
        if (!bars.isEmpty()) {
            checkStaleData(symbol, bars).ifPresent(issues::add);
        }
        issues.addAll(checkPriceOutliers(symbol, bars));
        issues.addAll(checkVolumeAnomalies(symbol, bars));

        for (QualityIssue issue : issues) {
            if (issue.getSeverity() == Severity.CRITICAL) {
                log.error("{}: {}", symbol, issue.getDescription());
            } else if (issue.getSeverity() == Severity.WARNING) {
                log.warn("{}: {}", symbol, issue.getDescription());
            }
        }
        return issues;
    }

    public QualityReport runFullCheck(Map<String, List<MarketData>> barsBySymbol, Timeframe timeframe) {
        Map<String, List<QualityIssue>> issues = new LinkedHashMap<>();
        barsBySymbol.forEach((symbol, bars) -> {
            List<QualityIssue> symbolIssues = checkSymbol(symbol, bars, timeframe);
            if (!symbolIssues.isEmpty()) {
                issues.put(symbol, symbolIssues);
            }
        });
        log.info("Quality check over {} symbols found issues for {}", barsBySymbol.size(), issues.size());
        return new QualityReport(clock.instant(), barsBySymbol.size(), issues);
    }

    private QualityIssue noData(String symbol, String description) {
        return QualityIssue.builder()
            .severity(Severity.CRITICAL)
            .type(IssueType.NO_DATA)
            .symbol(symbol)
            .timestamp(clock.instant())
            .description(description)
            .build();
    }

    private static List<MarketData> sorted(List<MarketData> bars) {
        List<MarketData> copy = new ArrayList<>(bars);
        copy.sort(Comparator.comparing(MarketData::getTimestamp));
        return copy;
    }
}
