/* (C)2026 */
package com.ammann.anomaly.dto;

import com.ammann.anomaly.model.AnomalyRecord;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Ordered anomaly log of a stream")
public record AnomalyLogResponseDTO(
        @Schema(description = "Stream identifier") String streamId,
        @Schema(description = "Number of anomalies found so far") int count,
        @Schema(description = "Anomalies in discovery order") List<AnomalyRecordDTO> anomalies) {

    public static AnomalyLogResponseDTO of(String streamId, List<AnomalyRecord> records) {
        List<AnomalyRecordDTO> anomalies = records.stream().map(AnomalyRecordDTO::from).toList();
        return new AnomalyLogResponseDTO(streamId, anomalies.size(), anomalies);
    }
}
