package com.reactivechat.socket.delivery;

import com.reactivechat.core.model.ConversationTarget;
import com.reactivechat.core.model.DeliveryEvent;
import com.reactivechat.core.model.Principal;
import reactor.core.publisher.Mono;

/**
 * Routes chat changes from a sender to every live connection of every recipient.
 * <p>
 * All mutating operations persist first and only then push and publish. Failures are
 * {@link com.reactivechat.core.error.ChatException}s: {@code CONVERSATION_NOT_FOUND},
 * {@code MESSAGE_NOT_FOUND}, {@code NOT_A_MEMBER}, {@code PERSISTENCE_FAILURE},
 * {@code BAD_REQUEST}. A publish failure is not an error but a degraded {@link SendResult}.
 * </p>
 */
public interface IDeliveryRouter {

    Mono<SendResult> send(Principal sender, ConversationTarget target, String payload);

    /**
     * Replaces the payload of a message; only its author may do so.
     */
    Mono<SendResult> edit(Principal sender, String messageId, String payload);

    /**
     * Tombstones a message; only its author may do so.
     */
    Mono<SendResult> delete(Principal sender, String messageId);

    /**
     * Records a read receipt and fans it out to the conversation.
     */
    Mono<SendResult> markRead(Principal reader, String messageId);

    /**
     * Pushes an event received from the broker to local connections of its recipients.
     * Never throws and never waits on a connection.
     */
    void onEvent(DeliveryEvent event);
}
