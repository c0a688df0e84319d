package com.reactivechat.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Shared delivery channel. Every node publishes here and every node consumes all of it
     * (one consumer group per node), so each node also receives its own events.
     */
    public static final String DELIVERY = "chat.delivery";

    /**
     * Prefix of the per-node consumer group on {@link #DELIVERY}.
     */
    public static final String DELIVERY_GROUP_PREFIX = "chat-node-";

    public static String deliveryGroupFor(String nodeId) {
        return DELIVERY_GROUP_PREFIX + nodeId;
    }
}
