/* (C)2026 */
package com.ammann.anomaly.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Effective detector configuration")
public record DetectorDefaultsDTO(
        @Schema(description = "Default window size for new streams") int windowSize,
        @Schema(description = "Default MSTD multiplier for new streams") double threshold,
        @Schema(description = "Whether the synthetic feed is running") boolean syntheticFeedEnabled,
        @Schema(description = "Stream the synthetic feed writes to") String syntheticStreamId) {}
