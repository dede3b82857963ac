/* (C)2026 */
package com.ammann.anomaly.detection;

import com.ammann.anomaly.exception.InvalidInputException;
import com.ammann.anomaly.model.AnomalyRecord;
import com.ammann.anomaly.model.DetectorConfig;
import com.ammann.anomaly.model.TickResult;
import com.ammann.anomaly.model.WindowStatistic;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-tick pipeline for one stream: {@link WindowStats} feeding {@link AnomalyDetector}.
 *
 * <p>Each independent stream owns its own instance. Not thread-safe.
 */
public class StreamDetector {

    private final DetectorConfig config;
    private final WindowStats windowStats;
    private final AnomalyDetector anomalyDetector;

    public StreamDetector(DetectorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.windowStats = new WindowStats(config.windowSize());
        this.anomalyDetector = new AnomalyDetector(config.threshold());
    }

    /**
     * Ingests one sample and classifies it against the window it completes.
     *
     * @param sample the newest sample
     * @return the tick triple (sample, statistic or none, verdict) with its tick index
     * @throws InvalidInputException if the sample is not finite; no tick is consumed
     */
    public TickResult process(double sample) {
        windowStats.ingest(sample);

        long tick = windowStats.samplesSeen() - 1;
        Optional<WindowStatistic> statistic = windowStats.currentStatistic();
        boolean anomaly = anomalyDetector.evaluate(sample, statistic);

        return new TickResult(tick, sample, statistic.orElse(null), anomaly);
    }

    /**
     * Discards the window and the anomaly log, keeping the configuration.
     */
    public void reset() {
        windowStats.reset();
        anomalyDetector.reset();
    }

    public Optional<WindowStatistic> currentStatistic() {
        return windowStats.currentStatistic();
    }

    public List<AnomalyRecord> anomalies() {
        return anomalyDetector.anomalies();
    }

    public int anomalyCount() {
        return anomalyDetector.anomalyCount();
    }

    public long samplesSeen() {
        return windowStats.samplesSeen();
    }

    public boolean isWarmingUp() {
        return windowStats.isWarmingUp();
    }

    public double[] window() {
        return windowStats.window();
    }

    public DetectorConfig config() {
        return config;
    }
}
