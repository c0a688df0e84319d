package com.reactivechat.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Where a client wants a message to go: a direct peer or a group.
 */
@Value
public class ConversationTarget {

    public enum Kind {
        DIRECT,
        GROUP
    }

    private static final String DIRECT_PREFIX = "direct:";
    private static final String GROUP_PREFIX = "group:";

    @JsonProperty("kind")
    Kind kind;

    /**
     * Peer principal id for {@link Kind#DIRECT}, group id for {@link Kind#GROUP}.
     */
    @JsonProperty("id")
    String id;

    @JsonCreator
    public ConversationTarget(@JsonProperty("kind") Kind kind, @JsonProperty("id") String id) {
        this.kind = kind;
        this.id = id;
    }

    public static ConversationTarget direct(String peerId) {
        return new ConversationTarget(Kind.DIRECT, peerId);
    }

    public static ConversationTarget group(String groupId) {
        return new ConversationTarget(Kind.GROUP, groupId);
    }

    /**
     * Resolves the conversation id as seen from {@code senderId}.
     * Direct conversations are keyed by the sorted pair so both peers resolve the same id.
     */
    @JsonIgnore
    public String conversationIdFor(String senderId) {
        if (kind == Kind.GROUP) {
            return GROUP_PREFIX + id;
        }
        return directConversationId(senderId, id);
    }

    public static String directConversationId(String first, String second) {
        return first.compareTo(second) <= 0
            ? DIRECT_PREFIX + first + ":" + second
            : DIRECT_PREFIX + second + ":" + first;
    }

    public static String groupConversationId(String groupId) {
        return GROUP_PREFIX + groupId;
    }
}
