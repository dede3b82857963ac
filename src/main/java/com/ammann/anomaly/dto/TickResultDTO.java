/* (C)2026 */
package com.ammann.anomaly.dto;

import com.ammann.anomaly.enumeration.TickVerdict;
import com.ammann.anomaly.model.TickResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Per-tick output: the sample, the statistic of the window it completes (absent
 * during warm-up) and the verdict.
 *
 * @param tick 0-based arrival position among accepted samples
 * @param sample ingested value
 * @param statistic window statistic, {@code null} during warm-up
 * @param anomaly whether the sample was flagged
 * @param verdict readable classification of the tick
 */
@Schema(description = "Outcome of one ingested sample")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TickResultDTO(
        @Schema(description = "0-based tick index") long tick,
        @Schema(description = "Ingested sample value") double sample,
        @Schema(description = "Window statistic, absent during warm-up") WindowStatisticDTO statistic,
        @Schema(description = "Whether the sample was flagged as anomalous") boolean anomaly,
        @Schema(description = "Classification of the tick") TickVerdict verdict) {

    public static TickResultDTO from(TickResult result) {
        return new TickResultDTO(
                result.tick(),
                result.sample(),
                WindowStatisticDTO.from(result.windowStatistic()),
                result.anomaly(),
                TickVerdict.of(result));
    }
}
