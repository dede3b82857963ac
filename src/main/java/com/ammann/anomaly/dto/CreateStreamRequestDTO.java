/* (C)2026 */
package com.ammann.anomaly.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request body for registering a stream. Omitted detector parameters fall back to
 * the configured defaults.
 *
 * @param id stream identifier
 * @param windowSize window size, at least 2
 * @param threshold positive MSTD multiplier
 */
@Schema(description = "Stream registration request")
public record CreateStreamRequestDTO(
        @Schema(description = "Stream identifier", required = true) String id,
        @Schema(description = "Window size (>= 2), defaults to the configured value") Integer windowSize,
        @Schema(description = "MSTD multiplier (> 0), defaults to the configured value") Double threshold) {}
