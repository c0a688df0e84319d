package com.reactivechat.socket.broker;

import com.reactivechat.core.msg.Topics;
import com.reactivechat.socket.config.SocketConfig;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Kafka transport.
 * <p>
 * Every node consumes the delivery topic in its own consumer group
 * ({@code chat-node-<nodeId>}), so each event reaches every node, the publisher included.
 * Records are keyed by conversation id, which keeps one conversation's events on one partition.
 * </p>
 */
public class KafkaBrokerTransport implements IBrokerTransport {
    private static final Logger log = LoggerFactory.getLogger(KafkaBrokerTransport.class);

    private static final int DEFAULT_PARTITIONS = 3;
    private static final short REPLICATION_FACTOR = 1;    // 1 for dev, 3+ for prod

    private final SocketConfig config;
    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;

    public KafkaBrokerTransport(SocketConfig config) {
        this.config = config;

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all"); // Required for idempotent producer
        producerProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        // The bridge retries with its own backoff; bound the client's internal retrying
        producerProps.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 10_000);
        producerProps.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 5_000);

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        log.info("Kafka producer and admin client initialized");
    }

    @Override
    public Mono<Void> start() {
        return createTopicIfNotExists(Topics.DELIVERY, DEFAULT_PARTITIONS, REPLICATION_FACTOR);
    }

    @Override
    public Mono<Void> publish(String channel, String key, String payload) {
        ProducerRecord<String, String> record = new ProducerRecord<>(channel, key, payload);
        return sender.send(Mono.just(SenderRecord.create(record, null)))
            .next()
            .flatMap(result -> result.exception() != null
                ? Mono.<Void>error(result.exception())
                : Mono.<Void>empty());
    }

    @Override
    public Flux<String> subscribe(String channel) {
        Map<String, Object> consumerProps = new HashMap<>();
        consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, Topics.deliveryGroupFor(config.getNodeId()));
        consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        // Live fan-out only: a restarted node does not replay what it missed
        consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

        ReceiverOptions<String, String> receiverOptions = ReceiverOptions.<String, String>create(consumerProps)
            .subscription(Collections.singleton(channel));

        log.info("Node {} subscribing to {} as group {}",
            config.getNodeId(), channel, Topics.deliveryGroupFor(config.getNodeId()));

        return KafkaReceiver.create(receiverOptions)
            .receive()
            .map(record -> {
                record.receiverOffset().acknowledge();
                return record.value();
            });
    }

    @Override
    public Mono<Void> stop() {
        sender.close();
        adminClient.close();
        log.info("Kafka transport stopped");
        return Mono.empty();
    }

    /**
     * Creates a Kafka topic if it doesn't already exist.
     *
     * @return Mono completing when topic is created or already exists
     */
    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }

                return Mono.fromFuture(() -> {
                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, partitions, replicationFactor);

                    return adminClient.createTopics(Collections.singleton(new NewTopic(topicName, partitions, replicationFactor)))
                        .all()
                        .toCompletionStage()
                        .toCompletableFuture();
                });
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }
                log.error("Failed to create Kafka topic {}: {}", topicName, error.getMessage(), error);
                return Mono.error(error);
            })
            .then();
    }
}
