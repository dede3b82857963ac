/* (C)2026 */
package com.ammann.anomaly.model;

/**
 * A sample flagged as anomalous.
 *
 * @param tick  0-based arrival position of the sample among accepted samples
 * @param value the sample value
 */
public record AnomalyRecord(long tick, double value) {}
