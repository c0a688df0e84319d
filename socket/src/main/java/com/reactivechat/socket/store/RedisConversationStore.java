package com.reactivechat.socket.store;

import com.reactivechat.core.model.StoredMessage;
import com.reactivechat.core.redis.Keys;
import io.lettuce.core.KeyValue;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Redis-backed conversation store.
 * <p>
 * Sequence numbers come from {@code INCR conv:{id}:seq}, which Redis serializes, so they are
 * strictly increasing per conversation even with many nodes writing.
 * </p>
 * <p>
 * Each member keeps a set of unread message ids per conversation. A new message is added to
 * every member's set but its author's; reads and deletes remove it.
 * </p>
 */
public class RedisConversationStore implements IConversationStore {
    private static final Logger log = LoggerFactory.getLogger(RedisConversationStore.class);

    private final RedisReactiveCommands<String, String> commands;

    public RedisConversationStore(RedisReactiveCommands<String, String> commands) {
        this.commands = commands;
    }

    @Override
    public Mono<Set<String>> membersOf(String conversationId) {
        return commands.smembers(Keys.conversationMembers(conversationId))
            .collect(HashSet<String>::new, HashSet::add)
            .filter(members -> !members.isEmpty())
            .map(Set::copyOf);
    }

    @Override
    public Mono<StoredMessage> persistMessage(String conversationId, String senderId, String payload) {
        long now = System.currentTimeMillis();
        return Mono.zip(
                commands.incr(Keys.conversationSequence(conversationId)),
                commands.incr(Keys.messageIds()))
            .flatMap(ids -> {
                StoredMessage message = StoredMessage.builder()
                    .messageId(String.valueOf(ids.getT2()))
                    .conversationId(conversationId)
                    .senderId(senderId)
                    .sequence(ids.getT1())
                    .payload(payload)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
                return commands.hset(Keys.message(message.getMessageId()), toHash(message))
                    .then(forEachMember(conversationId, senderId,
                        member -> commands.sadd(Keys.unread(conversationId, member), message.getMessageId())))
                    .thenReturn(message);
            })
            .doOnError(err -> log.error("Failed to persist message in {} from {}", conversationId, senderId, err));
    }

    @Override
    public Mono<StoredMessage> findMessage(String messageId) {
        return commands.hgetall(Keys.message(messageId))
            .collectMap(KeyValue::getKey, KeyValue::getValue)
            .filter(hash -> !hash.isEmpty())
            .map(hash -> fromHash(messageId, hash));
    }

    @Override
    public Mono<StoredMessage> updateMessage(String messageId, String payload) {
        return findMessage(messageId)
            .flatMap(message -> {
                StoredMessage updated = message.withPayload(payload).withUpdatedAt(System.currentTimeMillis());
                return commands.hset(Keys.message(messageId), toHash(updated)).thenReturn(updated);
            });
    }

    @Override
    public Mono<StoredMessage> deleteMessage(String messageId) {
        return findMessage(messageId)
            .flatMap(message -> {
                StoredMessage deleted = message.withDeleted(true).withPayload(null).withUpdatedAt(System.currentTimeMillis());
                return commands.hset(Keys.message(messageId), toHash(deleted))
                    .then(forEachMember(message.getConversationId(), null,
                        member -> commands.srem(Keys.unread(message.getConversationId(), member), messageId)))
                    .thenReturn(deleted);
            });
    }

    @Override
    public Mono<StoredMessage> markRead(String messageId, String readerId) {
        return findMessage(messageId)
            .flatMap(message -> commands.hsetnx(Keys.messageReads(messageId), readerId,
                    String.valueOf(System.currentTimeMillis()))
                .then(commands.srem(Keys.unread(message.getConversationId(), readerId), messageId))
                .thenReturn(message));
    }

    @Override
    public Mono<Long> unreadCount(String conversationId, String principalId) {
        return commands.scard(Keys.unread(conversationId, principalId));
    }

    private Mono<Void> forEachMember(String conversationId, String except, Function<String, Mono<Long>> action) {
        return commands.smembers(Keys.conversationMembers(conversationId))
            .filter(member -> !member.equals(except))
            .flatMap(action)
            .then();
    }

    private static Map<String, String> toHash(StoredMessage message) {
        Map<String, String> hash = new HashMap<>();
        hash.put("conversationId", message.getConversationId());
        hash.put("senderId", message.getSenderId());
        hash.put("sequence", String.valueOf(message.getSequence()));
        hash.put("payload", message.getPayload() == null ? "" : message.getPayload());
        hash.put("createdAt", String.valueOf(message.getCreatedAt()));
        hash.put("updatedAt", String.valueOf(message.getUpdatedAt()));
        hash.put("deleted", message.isDeleted() ? "1" : "0");
        return hash;
    }

    private static StoredMessage fromHash(String messageId, Map<String, String> hash) {
        return StoredMessage.builder()
            .messageId(messageId)
            .conversationId(hash.get("conversationId"))
            .senderId(hash.get("senderId"))
            .sequence(Long.parseLong(hash.get("sequence")))
            .payload(hash.get("payload"))
            .createdAt(Long.parseLong(hash.get("createdAt")))
            .updatedAt(Long.parseLong(hash.get("updatedAt")))
            .deleted("1".equals(hash.get("deleted")))
            .build();
    }
}
