package com.reactivechat.socket.store;

import com.reactivechat.core.model.ConversationTarget;
import com.reactivechat.core.model.StoredMessage;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local conversation store for single-node runs and tests.
 */
public class InMemoryConversationStore implements IConversationStore {

    private final Map<String, Set<String>> members = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();
    private final Map<String, StoredMessage> messages = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Long>> reads = new ConcurrentHashMap<>();
    private final AtomicLong messageIds = new AtomicLong();

    public InMemoryConversationStore createGroup(String groupId, Set<String> memberIds) {
        members.put(ConversationTarget.groupConversationId(groupId), ConcurrentHashMap.newKeySet());
        members.get(ConversationTarget.groupConversationId(groupId)).addAll(memberIds);
        return this;
    }

    public InMemoryConversationStore createDirect(String first, String second) {
        Set<String> pair = ConcurrentHashMap.newKeySet();
        pair.add(first);
        pair.add(second);
        members.put(ConversationTarget.directConversationId(first, second), pair);
        return this;
    }

    public Set<String> readersOf(String messageId) {
        return Set.copyOf(reads.getOrDefault(messageId, Map.of()).keySet());
    }

    @Override
    public Mono<Set<String>> membersOf(String conversationId) {
        return Mono.justOrEmpty(members.get(conversationId)).map(Set::copyOf);
    }

    @Override
    public Mono<StoredMessage> persistMessage(String conversationId, String senderId, String payload) {
        return Mono.fromSupplier(() -> {
            long now = System.currentTimeMillis();
            long sequence = sequences.computeIfAbsent(conversationId, id -> new AtomicLong()).incrementAndGet();
            StoredMessage message = StoredMessage.builder()
                .messageId(String.valueOf(messageIds.incrementAndGet()))
                .conversationId(conversationId)
                .senderId(senderId)
                .sequence(sequence)
                .payload(payload)
                .createdAt(now)
                .updatedAt(now)
                .build();
            messages.put(message.getMessageId(), message);
            return message;
        });
    }

    @Override
    public Mono<StoredMessage> findMessage(String messageId) {
        return Mono.justOrEmpty(messages.get(messageId));
    }

    @Override
    public Mono<StoredMessage> updateMessage(String messageId, String payload) {
        return Mono.justOrEmpty(messages.computeIfPresent(messageId, (id, current) -> current
            .withPayload(payload)
            .withUpdatedAt(System.currentTimeMillis())));
    }

    @Override
    public Mono<StoredMessage> deleteMessage(String messageId) {
        return Mono.justOrEmpty(messages.computeIfPresent(messageId, (id, current) -> current
            .withDeleted(true)
            .withPayload(null)
            .withUpdatedAt(System.currentTimeMillis())));
    }

    @Override
    public Mono<StoredMessage> markRead(String messageId, String readerId) {
        return findMessage(messageId)
            .doOnNext(message -> reads.computeIfAbsent(messageId, id -> new ConcurrentHashMap<>())
                .putIfAbsent(readerId, System.currentTimeMillis()));
    }

    @Override
    public Mono<Long> unreadCount(String conversationId, String principalId) {
        return Mono.fromSupplier(() -> messages.values().stream()
            .filter(message -> message.getConversationId().equals(conversationId))
            .filter(message -> !message.isDeleted())
            .filter(message -> !principalId.equals(message.getSenderId()))
            .filter(message -> !reads.getOrDefault(message.getMessageId(), Map.of()).containsKey(principalId))
            .count());
    }
}
