package com.reactivechat.core.metrics;

/**
 * Micrometer tag keys.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "nodeId";
    public static final String TYPE = "type";
    public static final String REASON = "reason";
    public static final String CODE = "code";
}
