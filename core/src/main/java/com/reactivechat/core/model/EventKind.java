package com.reactivechat.core.model;

/**
 * Kind of change carried by a {@link DeliveryEvent}.
 */
public enum EventKind {
    MESSAGE_CREATED,
    MESSAGE_UPDATED,
    MESSAGE_DELETED,
    STATUS_UPDATED,
    /**
     * Personal to one recipient: their unread count in a conversation changed.
     */
    UNREAD_COUNT_UPDATED
}
