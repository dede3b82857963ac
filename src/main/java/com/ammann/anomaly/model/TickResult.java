/* (C)2026 */
package com.ammann.anomaly.model;

import java.util.Optional;

/**
 * Outcome of pushing one sample through a stream detector.
 *
 * @param tick            0-based arrival position of the sample
 * @param sample          the ingested sample
 * @param windowStatistic statistic of the window including this sample, {@code null} during warm-up
 * @param anomaly         whether the sample was flagged
 */
public record TickResult(long tick, double sample, WindowStatistic windowStatistic, boolean anomaly) {

    public Optional<WindowStatistic> statistic() {
        return Optional.ofNullable(windowStatistic);
    }

    public boolean warmingUp() {
        return windowStatistic == null;
    }
}
