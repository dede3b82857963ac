/* (C)2026 */
package com.ammann.anomaly.detection;

import com.ammann.anomaly.exception.InvalidConfigException;
import com.ammann.anomaly.model.AnomalyRecord;
import com.ammann.anomaly.model.WindowStatistic;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Threshold rule over a window statistic, with an append-only log of flagged samples.
 *
 * <p>A sample is anomalous iff {@code |sample - MA| > threshold * MSTD}. The comparison
 * is strict, so a sample sitting exactly on the moving average is never flagged, even
 * when the moving standard deviation is zero. No verdict other than "normal" is
 * possible before the window first fills.
 *
 * <p>Every call to {@link #evaluate} consumes one tick; the caller invokes it exactly
 * once per accepted sample so that recorded tick indices match arrival positions.
 * Not thread-safe.
 */
public class AnomalyDetector {

    private static final Logger LOG = Logger.getLogger(AnomalyDetector.class);

    private final double threshold;
    private final List<AnomalyRecord> anomalies = new ArrayList<>();
    private long nextTick;

    /**
     * @param threshold multiple of the moving standard deviation that marks the anomaly boundary
     * @throws InvalidConfigException if the threshold is not a positive finite number
     */
    public AnomalyDetector(double threshold) {
        if (!Double.isFinite(threshold) || threshold <= 0) {
            throw InvalidConfigException.outOfRange("threshold", threshold, "positive finite number");
        }
        this.threshold = threshold;
    }

    /**
     * Decides whether the newest sample is anomalous and records it if so.
     *
     * @param sample    the newest sample
     * @param statistic the statistic of the window ending at this sample, empty during warm-up
     * @return {@code true} if the sample was flagged
     */
    public boolean evaluate(double sample, Optional<WindowStatistic> statistic) {
        Objects.requireNonNull(statistic, "statistic");
        long tick = nextTick++;

        if (statistic.isEmpty()) {
            return false;
        }

        WindowStatistic stat = statistic.get();
        boolean anomalous = stat.exceeds(sample, threshold);

        if (anomalous) {
            anomalies.add(new AnomalyRecord(tick, sample));
            LOG.debugf(
                    "Anomaly at tick %d: value=%.4f, ma=%.4f, mstd=%.4f",
                    tick, sample, stat.movingAverage(), stat.movingStdDev());
        }
        return anomalous;
    }

    /**
     * Read-only snapshot of all anomalies found so far, in discovery order.
     */
    public List<AnomalyRecord> anomalies() {
        return List.copyOf(anomalies);
    }

    public int anomalyCount() {
        return anomalies.size();
    }

    /**
     * Clears the anomaly log and restarts tick numbering at zero.
     */
    public void reset() {
        anomalies.clear();
        nextTick = 0;
    }

    public double threshold() {
        return threshold;
    }
}
