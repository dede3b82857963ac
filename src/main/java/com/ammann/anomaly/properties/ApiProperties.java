/* (C)2026 */
package com.ammann.anomaly.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /** Path parameter carrying the stream identifier. */
    public static final String STREAM_ID = "streamId";

    /**
     * Stream ingestion and detection endpoints
     */
    public static final class Streams {
        private Streams() {}

        public static final String BASE = "/streams";
        public static final String BY_ID = BASE + "/{" + STREAM_ID + "}";
        public static final String SAMPLES = BY_ID + "/samples";
        public static final String ANOMALIES = BY_ID + "/anomalies";
        public static final String RESET = BY_ID + "/reset";
    }

    /**
     * System monitoring endpoints
     */
    public static final class System {
        private System() {}

        public static final String BASE = "/system";
        public static final String CONFIG = BASE + "/config";
    }
}
