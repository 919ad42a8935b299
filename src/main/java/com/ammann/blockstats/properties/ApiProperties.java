/* (C)2026 */
package com.ammann.blockstats.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Path constants shared by the REST resources and the WebSocket endpoint.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path of the read-path REST API. */
    public static final String BASE_URL = "/api";

    /** WebSocket endpoint for live block and statistics updates. */
    public static final String WEBSOCKET_PATH = "/ws";

    /**
     * Throughput statistics endpoints
     */
    public static final class Stats {
        private Stats() {}

        public static final String BASE = "/stats";
    }

    /**
     * Block endpoints
     */
    public static final class Blocks {
        private Blocks() {}

        public static final String BASE = "/blocks";
        public static final String LATEST = BASE + "/latest";
        public static final String BY_NUMBER = BASE + "/{number}";
    }
}
