package com.tessera.model;

/**
 * HTTP headers for tool invocation control and result provenance.
 */
public final class ToolHeaders {

    // ========== Request Headers ==========

    public static final String SESSION_ID = "x-session-id";
    public static final String TRACE_ID = "x-trace-id";
    public static final String REQUEST_ID = "x-request-id";
    public static final String USER_ID = "x-user-id";

    /**
     * Skip the cache lookup.
     * Value: "true" or "false"
     */
    public static final String CACHE_BYPASS = "x-cache-bypass";

    /**
     * Whether a fresh result may be cached.
     * Value: "true" or "false"
     *
     * Example: x-cache-store: false (don't cache this result)
     */
    public static final String CACHE_STORE = "x-cache-store";

    // ========== Response Headers ==========

    public static final String CACHE_HIT = "x-cache-hit";

    /**
     * SUCCESS, CACHED, DEGRADED or PARTIAL.
     */
    public static final String TOOL_STATUS = "x-tool-status";

    /**
     * Fallback strategy that produced a degraded result.
     */
    public static final String FALLBACK_STRATEGY = "x-fallback-strategy";

    public static final String DURATION_MS = "x-duration-ms";

    private ToolHeaders() {
    }
}
