package com.qqsuccubus.roomcast.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "node_id";

    /**
     * Frame type, action class, channel kind or lifecycle event, depending on the metric.
     */
    public static final String TYPE = "type";

    /**
     * Failure/drop reason.
     */
    public static final String REASON = "reason";
}
