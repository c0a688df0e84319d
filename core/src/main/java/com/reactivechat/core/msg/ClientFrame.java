package com.reactivechat.core.msg;

import com.reactivechat.core.model.ConversationTarget;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Frame sent by a client over its real-time connection.
 * <p>
 * Types:
 * <ul>
 *   <li>{@code heartbeat}: liveness ping, answered with {@code heartbeat_ack}</li>
 *   <li>{@code send}: new message to {@code target}</li>
 *   <li>{@code edit}: replace the payload of {@code messageId}</li>
 *   <li>{@code delete}: tombstone {@code messageId}</li>
 *   <li>{@code read}: mark {@code messageId} as read</li>
 * </ul>
 * {@code ref} is an opaque client correlation id echoed on {@code ack} and {@code error}.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ClientFrame {
    public static final String HEARTBEAT = "heartbeat";
    public static final String SEND = "send";
    public static final String EDIT = "edit";
    public static final String DELETE = "delete";
    public static final String READ = "read";

    String type;
    String ref;
    ConversationTarget target;
    String messageId;
    String payload;
}
