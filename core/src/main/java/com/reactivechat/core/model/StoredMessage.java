package com.reactivechat.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * A message as acknowledged by the storage collaborator.
 */
@Value
@Builder(toBuilder = true)
@With
public class StoredMessage {
    String messageId;
    String conversationId;
    String senderId;
    long sequence;
    String payload;
    long createdAt;
    long updatedAt;
    boolean deleted;
}
