/* (C)2026 */
package com.ammann.anomaly.dto;

import com.ammann.anomaly.model.AnomalyRecord;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Sample flagged as anomalous")
public record AnomalyRecordDTO(
        @Schema(description = "0-based tick index of the sample") long tick,
        @Schema(description = "Sample value") double value) {

    public static AnomalyRecordDTO from(AnomalyRecord record) {
        return new AnomalyRecordDTO(record.tick(), record.value());
    }
}
