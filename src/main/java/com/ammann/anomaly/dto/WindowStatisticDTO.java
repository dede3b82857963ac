/* (C)2026 */
package com.ammann.anomaly.dto;

import com.ammann.anomaly.model.WindowStatistic;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Moving statistics over the current window")
public record WindowStatisticDTO(
        @Schema(description = "Moving average (MA)") double movingAverage,
        @Schema(description = "Moving population standard deviation (MSTD)") double movingStdDev) {

    public static WindowStatisticDTO from(WindowStatistic statistic) {
        return statistic == null
                ? null
                : new WindowStatisticDTO(statistic.movingAverage(), statistic.movingStdDev());
    }
}
