/* (C)2026 */
package com.ammann.intervals.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Program schedule endpoints
     */
    public static final class Programs {
        private Programs() {}

        public static final String BASE = "/programs";
        public static final String BY_NAME = "/{name}";
        public static final String INTERVALS = BY_NAME + "/intervals";
        public static final String SORT_BY_START = "start";
    }

    /**
     * Integrity validation endpoints
     */
    public static final class Integrity {
        private Integrity() {}

        public static final String BASE = "/integrity";
        public static final String REPORT = "/report";
        public static final String REPORT_TEXT = REPORT + "/text";
    }
}
