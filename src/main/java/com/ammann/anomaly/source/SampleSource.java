/* (C)2026 */
package com.ammann.anomaly.source;

/**
 * Lazy, unbounded producer of samples, one per logical tick.
 *
 * <p>Sources are not restartable: every call advances the sequence.
 */
public interface SampleSource {

    /**
     * Produces the next sample of the sequence.
     */
    double nextSample();

    /**
     * Number of samples produced so far.
     */
    long samplesProduced();
}
