/* (C)2026 */
package com.ammann.anomaly.source;

import com.ammann.anomaly.exception.InvalidConfigException;
import java.time.Clock;
import java.util.Random;

/**
 * Synthetic telemetry signal for demos and load: a Gaussian baseline, a seasonal
 * sine component and Gaussian noise.
 *
 * <p>Each sample is
 * {@code gauss(mu, sigma) + amplitude * sin(2 * pi * (t mod 60s) / 60s) + gauss(0, noiseSigma)},
 * where {@code t} is the wall-clock time read from the supplied {@link Clock}, so the
 * seasonal component completes one period per minute.
 */
public class SyntheticSampleSource implements SampleSource {

    public static final double DEFAULT_NORMAL_MU = 10.0;
    public static final double DEFAULT_NORMAL_SIGMA = 2.0;
    public static final double DEFAULT_SEASONAL_AMPLITUDE = 4.0;
    public static final double DEFAULT_NOISE_SIGMA = 0.5;

    private static final long SEASONAL_PERIOD_MS = 60_000L;

    private final double normalMu;
    private final double normalSigma;
    private final double seasonalAmplitude;
    private final double noiseSigma;
    private final Random random;
    private final Clock clock;
    private long samplesProduced;

    public SyntheticSampleSource() {
        this(DEFAULT_NORMAL_MU, DEFAULT_NORMAL_SIGMA, DEFAULT_SEASONAL_AMPLITUDE, DEFAULT_NOISE_SIGMA,
                new Random(), Clock.systemUTC());
    }

    /**
     * @param normalMu          value the baseline is distributed around
     * @param normalSigma       deviation of the baseline, non-negative
     * @param seasonalAmplitude amplitude of the seasonal sine wave
     * @param noiseSigma        deviation of the noise, non-negative
     * @param random            randomness for the Gaussian components
     * @param clock             time source for the seasonal component
     * @throws InvalidConfigException if a parameter is not finite or a sigma is negative
     */
    public SyntheticSampleSource(
            double normalMu,
            double normalSigma,
            double seasonalAmplitude,
            double noiseSigma,
            Random random,
            Clock clock) {
        requireFinite("normalMu", normalMu);
        requireFinite("seasonalAmplitude", seasonalAmplitude);
        requireNonNegative("normalSigma", normalSigma);
        requireNonNegative("noiseSigma", noiseSigma);
        if (random == null || clock == null) {
            throw new InvalidConfigException("Synthetic source requires a random generator and a clock");
        }

        this.normalMu = normalMu;
        this.normalSigma = normalSigma;
        this.seasonalAmplitude = seasonalAmplitude;
        this.noiseSigma = noiseSigma;
        this.random = random;
        this.clock = clock;
    }

    @Override
    public double nextSample() {
        double normal = normalMu + normalSigma * random.nextGaussian();
        double seasonal = seasonalAmplitude * Math.sin(2 * Math.PI * seasonalPhase());
        double noise = noiseSigma * random.nextGaussian();
        samplesProduced++;
        return normal + seasonal + noise;
    }

    /** Position within the current minute, in [0, 1). */
    double seasonalPhase() {
        return (double) Math.floorMod(clock.millis(), SEASONAL_PERIOD_MS) / SEASONAL_PERIOD_MS;
    }

    @Override
    public long samplesProduced() {
        return samplesProduced;
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw InvalidConfigException.outOfRange(name, value, "finite number");
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw InvalidConfigException.outOfRange(name, value, "finite number >= 0");
        }
    }
}
