/* (C)2026 */
package com.ammann.anomaly.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Current state of a stream detector")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamStatusDTO(
        @Schema(description = "Stream identifier") String streamId,
        @Schema(description = "Configured window size") int windowSize,
        @Schema(description = "Configured MSTD multiplier") double threshold,
        @Schema(description = "Accepted samples so far") long samplesSeen,
        @Schema(description = "Whether the window has not filled yet") boolean warmingUp,
        @Schema(description = "Current window statistic, absent during warm-up") WindowStatisticDTO statistic,
        @Schema(description = "Number of anomalies found so far") int anomalyCount) {}
