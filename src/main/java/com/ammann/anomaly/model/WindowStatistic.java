/* (C)2026 */
package com.ammann.anomaly.model;

/**
 * Moving average and moving population standard deviation of one full window.
 *
 * @param movingAverage arithmetic mean of the window
 * @param movingStdDev population standard deviation of the window (divides by the window size)
 */
public record WindowStatistic(double movingAverage, double movingStdDev) {

    /**
     * Distance of the sample from the moving average.
     */
    public double deviationOf(double sample) {
        return Math.abs(sample - movingAverage);
    }

    /**
     * Whether {@code |sample - movingAverage| > threshold * movingStdDev}, decided on
     * halved operands when either side overflows.
     */
    public boolean exceeds(double sample, double threshold) {
        double deviation = deviationOf(sample);
        double bound = threshold * movingStdDev;
        if (Double.isInfinite(deviation) || Double.isInfinite(bound)) {
            return Math.abs(sample * 0.5 - movingAverage * 0.5) > threshold * (movingStdDev * 0.5);
        }
        return deviation > bound;
    }
}
