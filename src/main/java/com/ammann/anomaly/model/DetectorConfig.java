/* (C)2026 */
package com.ammann.anomaly.model;

import com.ammann.anomaly.exception.InvalidConfigException;

/**
 * Immutable configuration of one stream detector.
 *
 * <p>Validated on construction: a window needs at least two samples and the
 * threshold must be a positive finite multiplier.
 *
 * @param windowSize number of most recent samples the statistic covers
 * @param threshold  multiple of the moving standard deviation a sample must exceed to be anomalous
 */
public record DetectorConfig(int windowSize, double threshold) {

    public static final int DEFAULT_WINDOW_SIZE = 3;
    public static final double DEFAULT_THRESHOLD = 1.2;
    public static final int MIN_WINDOW_SIZE = 2;

    public DetectorConfig {
        if (windowSize < MIN_WINDOW_SIZE) {
            throw InvalidConfigException.outOfRange(
                    "windowSize", windowSize, "integer >= " + MIN_WINDOW_SIZE);
        }
        if (!Double.isFinite(threshold) || threshold <= 0) {
            throw InvalidConfigException.outOfRange("threshold", threshold, "positive finite number");
        }
    }

    public static DetectorConfig defaults() {
        return new DetectorConfig(DEFAULT_WINDOW_SIZE, DEFAULT_THRESHOLD);
    }
}
