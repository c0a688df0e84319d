package com.reactivechat.socket.store;

import com.reactivechat.core.model.StoredMessage;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Storage collaborator for conversations and messages (Dependency Inversion Principle).
 * <p>
 * The store owns durability, sequence assignment and idempotent writes. Every method signals
 * failures as errors; the router turns them into {@code PERSISTENCE_FAILURE}.
 * </p>
 */
public interface IConversationStore {

    /**
     * @param conversationId {@code direct:<a>:<b>} or {@code group:<id>}
     * @return member principal ids, or empty if the conversation does not exist
     */
    Mono<Set<String>> membersOf(String conversationId);

    /**
     * Durably stores a new message and assigns the next sequence number of its conversation.
     */
    Mono<StoredMessage> persistMessage(String conversationId, String senderId, String payload);

    /**
     * @return the message, or empty if unknown
     */
    Mono<StoredMessage> findMessage(String messageId);

    /**
     * Replaces the payload of a message. The sequence number is unchanged.
     */
    Mono<StoredMessage> updateMessage(String messageId, String payload);

    /**
     * Marks a message deleted.
     */
    Mono<StoredMessage> deleteMessage(String messageId);

    /**
     * Records that {@code readerId} has read the message.
     */
    Mono<StoredMessage> markRead(String messageId, String readerId);

    /**
     * Messages of a conversation that {@code principalId} did not write, has not read and that
     * are not deleted.
     */
    Mono<Long> unreadCount(String conversationId, String principalId);
}
