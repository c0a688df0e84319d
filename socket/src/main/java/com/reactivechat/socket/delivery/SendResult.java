package com.reactivechat.socket.delivery;

import com.reactivechat.core.model.DeliveryEvent;
import lombok.Value;

/**
 * Outcome of a successful send. {@code degraded} means the message is stored and was pushed
 * locally, but publishing to other nodes failed after retries.
 */
@Value
public class SendResult {
    DeliveryEvent event;
    boolean degraded;

    public static SendResult delivered(DeliveryEvent event) {
        return new SendResult(event, false);
    }

    public static SendResult degraded(DeliveryEvent event) {
        return new SendResult(event, true);
    }
}
