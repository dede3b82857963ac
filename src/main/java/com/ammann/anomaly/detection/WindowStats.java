/* (C)2026 */
package com.ammann.anomaly.detection;

import com.ammann.anomaly.exception.InvalidConfigException;
import com.ammann.anomaly.exception.InvalidInputException;
import com.ammann.anomaly.model.WindowStatistic;
import java.util.Arrays;
import java.util.Optional;

/**
 * Sliding window over the most recent samples of one stream.
 *
 * <p>The window is a fixed-capacity ring buffer: once {@code windowSize} samples have
 * arrived, each new sample evicts the oldest one. The moving average and the moving
 * population standard deviation are recomputed from the literal window contents on
 * every ingest (two passes: mean first, then mean of squared deviations), so the
 * statistic never accumulates rounding drift from running sums.
 *
 * <p>During warm-up (fewer than {@code windowSize} samples seen) no statistic is
 * available. Only the latest statistic is kept.
 *
 * <p>Not thread-safe. Callers serialize access to one instance.
 */
public class WindowStats {

    private final int windowSize;
    private final double[] window;

    // Next write position; once the window is full it is also the oldest sample.
    private int head;
    private int size;
    private long samplesSeen;
    private WindowStatistic current;

    /**
     * @param windowSize capacity of the window, at least 1
     * @throws InvalidConfigException if {@code windowSize < 1}
     */
    public WindowStats(int windowSize) {
        if (windowSize < 1) {
            throw InvalidConfigException.outOfRange("windowSize", windowSize, "integer >= 1");
        }
        this.windowSize = windowSize;
        this.window = new double[windowSize];
    }

    /**
     * Appends a sample to the window and, once the window is full, recomputes the statistic.
     *
     * @param sample the newest sample
     * @throws InvalidInputException if the sample is NaN or infinite; nothing is appended
     */
    public void ingest(double sample) {
        if (!Double.isFinite(sample)) {
            throw InvalidInputException.nonFinite(sample);
        }

        window[head] = sample;
        head = (head + 1) % windowSize;
        if (size < windowSize) {
            size++;
        }
        samplesSeen++;

        if (size == windowSize) {
            current = computeStatistic();
        }
    }

    /**
     * Statistic of the last {@code windowSize} samples as of the most recent ingest,
     * or empty during warm-up.
     */
    public Optional<WindowStatistic> currentStatistic() {
        return Optional.ofNullable(current);
    }

    private WindowStatistic computeStatistic() {
        double maxAbs = 0.0;
        for (double sample : window) {
            maxAbs = Math.max(maxAbs, Math.abs(sample));
        }
        if (maxAbs == 0.0) {
            return new WindowStatistic(0.0, 0.0);
        }

        // Power-of-two scaling keeps every sample in (-2, 2) so sums and squares stay finite.
        // It is exact for all samples outside the subnormal range.
        int exponent = Math.getExponent(maxAbs);

        double sum = 0.0;
        for (int i = 0; i < windowSize; i++) {
            sum += Math.scalb(window[(head + i) % windowSize], -exponent);
        }
        double mean = sum / windowSize;

        double squaredDeviations = 0.0;
        for (int i = 0; i < windowSize; i++) {
            double deviation = Math.scalb(window[(head + i) % windowSize], -exponent) - mean;
            squaredDeviations += deviation * deviation;
        }
        double variance = squaredDeviations / windowSize;

        return new WindowStatistic(
                Math.scalb(mean, exponent), Math.scalb(Math.sqrt(variance), exponent));
    }

    /**
     * Copy of the current window, oldest sample first.
     */
    public double[] window() {
        double[] copy = new double[size];
        int oldest = size < windowSize ? 0 : head;
        for (int i = 0; i < size; i++) {
            copy[i] = window[(oldest + i) % windowSize];
        }
        return copy;
    }

    /**
     * Empties the window, returning this instance to its freshly constructed state.
     */
    public void reset() {
        Arrays.fill(window, 0.0);
        head = 0;
        size = 0;
        samplesSeen = 0;
        current = null;
    }

    public boolean isWarmingUp() {
        return size < windowSize;
    }

    public int size() {
        return size;
    }

    public int windowSize() {
        return windowSize;
    }

    public long samplesSeen() {
        return samplesSeen;
    }
}
