package com.reactivechat.socket.broker;

import com.reactivechat.core.error.ChatException;
import com.reactivechat.core.error.ErrorCode;
import com.reactivechat.core.model.DeliveryEvent;
import com.reactivechat.core.msg.Topics;
import com.reactivechat.core.util.JitterBackoff;
import com.reactivechat.core.util.JsonUtils;
import com.reactivechat.socket.config.SocketConfig;
import com.reactivechat.socket.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Cross-node fan-out over the shared delivery channel.
 * <p>
 * Publishing retries with jittered backoff and, once retries are exhausted, fails with
 * {@code PUBLISH_FAILURE}. Subscribers receive every event on the channel including the ones
 * this node published; duplicates are the receiver's concern.
 * </p>
 */
public class BrokerBridge {
    private static final Logger log = LoggerFactory.getLogger(BrokerBridge.class);

    private final IBrokerTransport transport;
    private final SocketConfig config;
    private final MetricsService metricsService;

    public BrokerBridge(IBrokerTransport transport, SocketConfig config, MetricsService metricsService) {
        this.transport = transport;
        this.config = config;
        this.metricsService = metricsService;
    }

    public Mono<Void> publish(DeliveryEvent event) {
        return Mono.defer(() -> {
            String json = JsonUtils.writeValueAsString(event);
            long startNanos = System.nanoTime();
            Duration base = config.getPublishRetryBackoff();

            return Mono.defer(() -> transport.publish(Topics.DELIVERY, event.getConversationId(), json))
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    if (signal.totalRetries() >= config.getPublishMaxRetries()) {
                        return Mono.<Long>error(signal.failure());
                    }
                    Duration delay = JitterBackoff.next(
                        (int) signal.totalRetries(), base, base.multipliedBy(10), base
                    );
                    log.warn("Publish of event {} failed (attempt {}), retrying in {}ms: {}",
                        event.getEventId(), signal.totalRetries() + 1, delay.toMillis(),
                        signal.failure().getMessage());
                    return Mono.delay(delay);
                })))
                .doOnSuccess(v -> {
                    metricsService.recordPublishLatency(startNanos);
                    log.debug("Published event {} ({} seq={})",
                        event.getEventId(), event.getConversationId(), event.getSequence());
                })
                .onErrorMap(err -> !(err instanceof ChatException), err -> {
                    metricsService.recordPublishFailure();
                    log.error("Giving up publishing event {} for message {}",
                        event.getEventId(), event.getMessageId(), err);
                    return new ChatException(ErrorCode.PUBLISH_FAILURE,
                        "Message stored but fan-out is delayed", err);
                });
        });
    }

    /**
     * Invokes {@code handler} once per received event. Undecodable payloads are logged and
     * skipped; the subscription survives handler and transport errors.
     *
     * @return handle to cancel the subscription
     */
    public Disposable subscribe(Consumer<DeliveryEvent> handler) {
        return transport.subscribe(Topics.DELIVERY)
            .<DeliveryEvent>handle((json, sink) -> {
                try {
                    sink.next(JsonUtils.readValue(json, DeliveryEvent.class));
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping undecodable delivery payload: {}", e.getMessage());
                }
            })
            .doOnNext(handler)
            .onErrorContinue((err, obj) -> log.error("Error in delivery consumer loop", err))
            .subscribe();
    }

    public Mono<Void> start() {
        return transport.start();
    }

    public Mono<Void> stop() {
        return transport.stop();
    }
}
