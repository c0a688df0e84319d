package com.reactivechat.socket.delivery;

import com.reactivechat.core.error.ChatException;
import com.reactivechat.core.error.ErrorCode;
import com.reactivechat.core.model.ConversationTarget;
import com.reactivechat.core.model.DeliveryEvent;
import com.reactivechat.core.model.EventKind;
import com.reactivechat.core.model.Principal;
import com.reactivechat.core.model.StoredMessage;
import com.reactivechat.socket.broker.BrokerBridge;
import com.reactivechat.socket.config.SocketConfig;
import com.reactivechat.socket.metrics.MetricsService;
import com.reactivechat.socket.session.Connection;
import com.reactivechat.socket.session.SessionRegistry;
import com.reactivechat.socket.store.IConversationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Delivery router of one node.
 * <p>
 * <b>Send path:</b> resolve members, check the sender, persist, push to local connections,
 * then publish. The event id is marked seen before the local push, so the broker echo of the
 * same event is dropped instead of being pushed a second time.
 * </p>
 * <p>
 * <b>Unread counts:</b> after a new message, a delete or a read, each affected member gets a
 * personal {@link EventKind#UNREAD_COUNT_UPDATED} event with their count for the conversation.
 * A message never counts as unread for its own author.
 * </p>
 * <p>
 * <b>Receive path:</b> {@link #onEvent} pushes events from the broker to local connections
 * unless their id was already seen. Recipients without a live connection on this node are
 * skipped; there is no server-side queue beyond each connection's own.
 * </p>
 */
public class DeliveryRouter implements IDeliveryRouter {
    private static final Logger log = LoggerFactory.getLogger(DeliveryRouter.class);

    private final IConversationStore store;
    private final SessionRegistry registry;
    private final BrokerBridge bridge;
    private final EventDeduplicator deduplicator;
    private final MetricsService metricsService;
    private final String nodeId;

    public DeliveryRouter(
        IConversationStore store,
        SessionRegistry registry,
        BrokerBridge bridge,
        EventDeduplicator deduplicator,
        MetricsService metricsService,
        SocketConfig config
    ) {
        this.store = store;
        this.registry = registry;
        this.bridge = bridge;
        this.deduplicator = deduplicator;
        this.metricsService = metricsService;
        this.nodeId = config.getNodeId();
    }

    @Override
    public Mono<SendResult> send(Principal sender, ConversationTarget target, String payload) {
        if (target == null || target.getKind() == null || target.getId() == null || target.getId().isBlank()) {
            return Mono.error(new ChatException(ErrorCode.BAD_REQUEST, "Missing conversation target"));
        }
        if (payload == null) {
            return Mono.error(new ChatException(ErrorCode.BAD_REQUEST, "Missing payload"));
        }

        String senderId = sender.getUserId();
        String conversationId = target.conversationIdFor(senderId);

        return membersOf(conversationId)
            .flatMap(members -> {
                if (!members.contains(senderId)) {
                    return Mono.<SendResult>error(new ChatException(ErrorCode.NOT_A_MEMBER,
                        senderId + " is not a member of " + conversationId));
                }

                long startNanos = System.nanoTime();
                return store.persistMessage(conversationId, senderId, payload)
                    .doOnSuccess(stored -> metricsService.recordPersistLatency(startNanos))
                    .onErrorMap(storageFailure("persist message in " + conversationId))
                    .flatMap(stored -> dispatch(toEvent(EventKind.MESSAGE_CREATED, stored, senderId,
                            stored.getPayload(), members))
                        .flatMap(result -> announceUnread(stored, senderId, othersThan(senderId, members))
                            .thenReturn(result)));
            });
    }

    @Override
    public Mono<SendResult> edit(Principal sender, String messageId, String payload) {
        if (payload == null) {
            return Mono.error(new ChatException(ErrorCode.BAD_REQUEST, "Missing payload"));
        }
        return authoredMessage(sender, messageId)
            .flatMap(members -> store.updateMessage(messageId, payload)
                .onErrorMap(storageFailure("update message " + messageId))
                .switchIfEmpty(Mono.error(() -> messageNotFound(messageId)))
                .flatMap(stored -> dispatch(toEvent(EventKind.MESSAGE_UPDATED, stored, sender.getUserId(),
                    stored.getPayload(), members))));
    }

    @Override
    public Mono<SendResult> delete(Principal sender, String messageId) {
        return authoredMessage(sender, messageId)
            .flatMap(members -> store.deleteMessage(messageId)
                .onErrorMap(storageFailure("delete message " + messageId))
                .switchIfEmpty(Mono.error(() -> messageNotFound(messageId)))
                .flatMap(stored -> dispatch(toEvent(EventKind.MESSAGE_DELETED, stored, sender.getUserId(),
                        null, members))
                    .flatMap(result -> announceUnread(stored, sender.getUserId(),
                            othersThan(sender.getUserId(), members))
                        .thenReturn(result))));
    }

    @Override
    public Mono<SendResult> markRead(Principal reader, String messageId) {
        String readerId = reader.getUserId();
        return visibleMessage(messageId)
            .flatMap(message -> membersOf(message.getConversationId())
                .flatMap(members -> {
                    if (!members.contains(readerId)) {
                        return Mono.<SendResult>error(new ChatException(ErrorCode.NOT_A_MEMBER,
                            readerId + " is not a member of " + message.getConversationId()));
                    }
                    return store.markRead(messageId, readerId)
                        .onErrorMap(storageFailure("mark message " + messageId + " read"))
                        .switchIfEmpty(Mono.error(() -> messageNotFound(messageId)))
                        .flatMap(stored -> dispatch(toEvent(EventKind.STATUS_UPDATED, stored, readerId,
                                null, members))
                            .flatMap(result -> announceUnread(stored, readerId, Set.of(readerId)).thenReturn(result)));
                }));
    }

    @Override
    public void onEvent(DeliveryEvent event) {
        try {
            if (!deduplicator.markSeen(event.getEventId())) {
                metricsService.recordDuplicate();
                log.debug("Suppressed duplicate event {}", event.getEventId());
                return;
            }
            int pushed = pushLocal(event);
            metricsService.recordDeliverBridge(pushed);
        } catch (RuntimeException e) {
            log.error("Failed to push event {} from node {}", event.getEventId(), event.getOriginNodeId(), e);
        }
    }

    private Mono<SendResult> dispatch(DeliveryEvent event) {
        metricsService.recordSend(event.getKind());

        deduplicator.markSeen(event.getEventId());
        int pushed = pushLocal(event);
        metricsService.recordDeliverLocal(pushed);

        return bridge.publish(event)
            .thenReturn(SendResult.delivered(event))
            .onErrorResume(err -> {
                log.warn("Degraded delivery of {} {} in {}: {}",
                    event.getKind(), event.getMessageId(), event.getConversationId(), err.getMessage());
                return Mono.just(SendResult.degraded(event));
            });
    }

    /**
     * Sends each recipient their new unread count in the message's conversation. A failure
     * only skips that recipient's update; the change that triggered it stands.
     */
    private Mono<Void> announceUnread(StoredMessage message, String actorId, Set<String> recipients) {
        String conversationId = message.getConversationId();
        return Flux.fromIterable(recipients)
            .flatMap(recipientId -> store.unreadCount(conversationId, recipientId)
                .flatMap(count -> dispatch(toEvent(EventKind.UNREAD_COUNT_UPDATED, message, actorId,
                        null, Set.of(recipientId))
                    .withUnreadCount(count)))
                .onErrorResume(err -> {
                    log.warn("Unread count of {} in {} not updated: {}", recipientId, conversationId,
                        err.getMessage());
                    return Mono.empty();
                }))
            .then();
    }

    private static Set<String> othersThan(String principalId, Set<String> members) {
        return members.stream()
            .filter(member -> !member.equals(principalId))
            .collect(Collectors.toUnmodifiableSet());
    }

    private int pushLocal(DeliveryEvent event) {
        int pushed = 0;
        for (String recipientId : event.getRecipients()) {
            for (Connection connection : registry.connectionsFor(recipientId)) {
                if (connection.offerEvent(event)) {
                    pushed++;
                } else {
                    metricsService.recordDrop();
                }
            }
        }
        log.debug("Pushed {} {} seq={} to {} local connection(s)",
            event.getKind(), event.getMessageId(), event.getSequence(), pushed);
        return pushed;
    }

    /**
     * Checks that {@code sender} wrote the message and still belongs to its conversation.
     *
     * @return the conversation's members
     */
    private Mono<Set<String>> authoredMessage(Principal sender, String messageId) {
        String senderId = sender.getUserId();
        return visibleMessage(messageId)
            .flatMap(message -> {
                if (!senderId.equals(message.getSenderId())) {
                    return Mono.<Set<String>>error(new ChatException(ErrorCode.NOT_A_MEMBER,
                        "Only the author may change message " + messageId));
                }
                return membersOf(message.getConversationId())
                    .flatMap(members -> members.contains(senderId)
                        ? Mono.just(members)
                        : Mono.<Set<String>>error(new ChatException(ErrorCode.NOT_A_MEMBER,
                            senderId + " is not a member of " + message.getConversationId())));
            });
    }

    private Mono<StoredMessage> visibleMessage(String messageId) {
        if (messageId == null || messageId.isBlank()) {
            return Mono.error(new ChatException(ErrorCode.BAD_REQUEST, "Missing messageId"));
        }
        return store.findMessage(messageId)
            .onErrorMap(storageFailure("load message " + messageId))
            .filter(message -> !message.isDeleted())
            .switchIfEmpty(Mono.error(() -> messageNotFound(messageId)));
    }

    private Mono<Set<String>> membersOf(String conversationId) {
        return store.membersOf(conversationId)
            .onErrorMap(storageFailure("resolve members of " + conversationId))
            .switchIfEmpty(Mono.error(() -> new ChatException(ErrorCode.CONVERSATION_NOT_FOUND,
                "Conversation " + conversationId + " not found")));
    }

    private DeliveryEvent toEvent(EventKind kind, StoredMessage stored, String actorId,
                                  String payload, Set<String> recipients) {
        return DeliveryEvent.builder()
            .eventId(UUID.randomUUID().toString())
            .kind(kind)
            .messageId(stored.getMessageId())
            .conversationId(stored.getConversationId())
            .senderId(actorId)
            .sequence(stored.getSequence())
            .payload(payload)
            .recipients(recipients)
            .ts(System.currentTimeMillis())
            .originNodeId(nodeId)
            .build();
    }

    private static ChatException messageNotFound(String messageId) {
        return new ChatException(ErrorCode.MESSAGE_NOT_FOUND, "Message " + messageId + " not found");
    }

    private static Function<Throwable, Throwable> storageFailure(String operation) {
        return err -> {
            if (err instanceof ChatException) {
                return err;
            }
            log.error("Failed to {}", operation, err);
            return new ChatException(ErrorCode.PERSISTENCE_FAILURE, "Failed to " + operation, err);
        };
    }

}
