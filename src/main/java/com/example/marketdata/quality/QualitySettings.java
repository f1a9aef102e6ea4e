package com.example.marketdata.quality;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Thresholds for {@link BarQualityChecker}.
 */
@Value
@Builder
public class QualitySettings {

    /** Latest bar older than this is stale. */
    @Builder.Default
    Duration staleAfter = Duration.ofHours(1);

    /** A gap wider than this multiple of the bar duration counts as missing bars. */
    @Builder.Default
    double gapTolerance = 1.5;

    /** |z-score| of a bar-to-bar return above this is an outlier. */
    @Builder.Default
    double outlierZ = 5.0;

    /** Volume above this multiple of the rolling mean is an anomaly. */
    @Builder.Default
    double volumeMultiplier = 3.0;

    @Builder.Default
    int volumeWindow = 20;

    /** Outlier and volume checks are skipped below this many bars. */
    @Builder.Default
    int minBars = 10;

    public static QualitySettings defaults() {
        return QualitySettings.builder().build();
    }
}
