package com.reactivechat.core.msg;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.reactivechat.core.error.ErrorCode;
import com.reactivechat.core.model.DeliveryEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Frame pushed by the server to a client.
 * <p>
 * Only the fields relevant to a given {@code type} are set; nulls are omitted on the wire.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServerFrame {
    public static final String WELCOME = "welcome";
    public static final String EVENT = "event";
    public static final String ACK = "ack";
    public static final String ERROR = "error";
    public static final String HEARTBEAT_ACK = "heartbeat_ack";
    public static final String CLOSING = "closing";

    String type;
    String ref;

    // welcome
    String nodeId;
    String connectionId;
    String principalId;
    String displayName;
    Long heartbeatIntervalMs;

    // event
    DeliveryEvent event;
    /**
     * Set when the event's sequence is lower than one already pushed for the same
     * conversation on this connection. Clients place it by sequence, not arrival.
     */
    Boolean late;

    // ack
    String messageId;
    Long sequence;
    Boolean degraded;

    // error / closing
    String code;
    String message;
    Long retryAfterMs;

    public static ServerFrame welcome(String nodeId, String connectionId, String principalId,
                                      String displayName, long heartbeatIntervalMs) {
        return ServerFrame.builder()
            .type(WELCOME)
            .nodeId(nodeId)
            .connectionId(connectionId)
            .principalId(principalId)
            .displayName(displayName)
            .heartbeatIntervalMs(heartbeatIntervalMs)
            .build();
    }

    public static ServerFrame event(DeliveryEvent event, boolean late) {
        return ServerFrame.builder()
            .type(EVENT)
            .event(event)
            .late(late ? Boolean.TRUE : null)
            .build();
    }

    public static ServerFrame ack(String ref, String messageId, long sequence, boolean degraded) {
        return ServerFrame.builder()
            .type(ACK)
            .ref(ref)
            .messageId(messageId)
            .sequence(sequence)
            .degraded(degraded)
            .build();
    }

    public static ServerFrame error(String ref, ErrorCode code, String message) {
        return ServerFrame.builder()
            .type(ERROR)
            .ref(ref)
            .code(code.name())
            .message(message)
            .build();
    }

    public static ServerFrame heartbeatAck() {
        return ServerFrame.builder().type(HEARTBEAT_ACK).build();
    }

    public static ServerFrame closing(String reason, String message, Long retryAfterMs) {
        return ServerFrame.builder()
            .type(CLOSING)
            .code(reason)
            .message(message)
            .retryAfterMs(retryAfterMs)
            .build();
    }
}
