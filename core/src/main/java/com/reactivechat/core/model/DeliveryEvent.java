package com.reactivechat.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Set;

/**
 * Unit of real-time fan-out.
 * <p>
 * <b>Durability:</b> an event is only built after its message has been persisted, so
 * {@code sequence} is always the storage-assigned ordering key of the conversation.
 * </p>
 * <p>
 * <b>At-least-once:</b> events travel through the broker and are echoed back to the node that
 * published them. Receivers deduplicate by {@code eventId}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class DeliveryEvent {
    /**
     * Unique per published event (a message edit gets a new event id).
     */
    @JsonProperty("eventId")
    String eventId;

    @JsonProperty("kind")
    EventKind kind;

    @JsonProperty("messageId")
    String messageId;

    /**
     * {@code direct:<a>:<b>} or {@code group:<id>}.
     */
    @JsonProperty("conversationId")
    String conversationId;

    /**
     * Author of the change (the reader for {@link EventKind#STATUS_UPDATED}).
     */
    @JsonProperty("senderId")
    String senderId;

    /**
     * Storage-assigned, strictly increasing within one conversation.
     */
    @JsonProperty("sequence")
    long sequence;

    @JsonProperty("payload")
    String payload;

    @JsonProperty("recipients")
    Set<String> recipients;

    /**
     * Creation timestamp (epoch millis).
     */
    @JsonProperty("ts")
    long ts;

    @JsonProperty("originNodeId")
    String originNodeId;

    /**
     * Set only on {@link EventKind#UNREAD_COUNT_UPDATED}: the recipient's unread messages in
     * the conversation after the change.
     */
    @JsonProperty("unreadCount")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    Long unreadCount;

    @JsonCreator
    public DeliveryEvent(
        @JsonProperty("eventId") String eventId,
        @JsonProperty("kind") EventKind kind,
        @JsonProperty("messageId") String messageId,
        @JsonProperty("conversationId") String conversationId,
        @JsonProperty("senderId") String senderId,
        @JsonProperty("sequence") long sequence,
        @JsonProperty("payload") String payload,
        @JsonProperty("recipients") Set<String> recipients,
        @JsonProperty("ts") long ts,
        @JsonProperty("originNodeId") String originNodeId,
        @JsonProperty("unreadCount") Long unreadCount
    ) {
        this.eventId = eventId;
        this.kind = kind;
        this.messageId = messageId;
        this.conversationId = conversationId;
        this.senderId = senderId;
        this.sequence = sequence;
        this.payload = payload;
        this.recipients = recipients == null ? Set.of() : Set.copyOf(recipients);
        this.ts = ts;
        this.originNodeId = originNodeId;
        this.unreadCount = unreadCount;
    }
}
