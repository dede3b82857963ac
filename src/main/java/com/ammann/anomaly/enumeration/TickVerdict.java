/* (C)2026 */
package com.ammann.anomaly.enumeration;

import com.ammann.anomaly.model.TickResult;

/**
 * Classification of a single ingested sample.
 */
public enum TickVerdict
{
    /** The window is not yet full, so no statistic and no verdict exist. */
    WARMING_UP,
    /** Deviation from the moving average is within the threshold. */
    NORMAL,
    /** Deviation from the moving average exceeds threshold times the moving standard deviation. */
    ANOMALOUS;

    public static TickVerdict of(TickResult result) {
        if (result.warmingUp()) return WARMING_UP;
        return result.anomaly() ? ANOMALOUS : NORMAL;
    }
}
