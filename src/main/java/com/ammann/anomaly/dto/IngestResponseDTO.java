/* (C)2026 */
package com.ammann.anomaly.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Per-tick results for accepted samples plus the rejected ones.
 *
 * @param streamId stream identifier
 * @param accepted number of samples that entered the window
 * @param rejected number of samples refused
 * @param anomalies number of accepted samples flagged in this batch
 * @param ticks per-tick results in arrival order
 * @param rejections refused samples, by position in the request
 */
@Schema(description = "Result of ingesting a batch of samples")
public record IngestResponseDTO(
        @Schema(description = "Stream identifier") String streamId,
        @Schema(description = "Samples accepted into the window") int accepted,
        @Schema(description = "Samples rejected") int rejected,
        @Schema(description = "Anomalies flagged in this batch") int anomalies,
        @Schema(description = "Per-tick results") List<TickResultDTO> ticks,
        @Schema(description = "Rejected samples") List<RejectedSampleDTO> rejections) {

    /**
     * A sample refused by the window.
     *
     * @param index position of the sample in the request body
     * @param reason why the sample was refused
     */
    @Schema(description = "Rejected sample")
    public record RejectedSampleDTO(
            @Schema(description = "Position in the request body") int index,
            @Schema(description = "Rejection reason") String reason) {}
}
