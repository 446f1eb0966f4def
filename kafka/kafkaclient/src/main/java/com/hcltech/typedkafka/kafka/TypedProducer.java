package com.hcltech.typedkafka.kafka;

import com.hcltech.typedkafka.common.errorsor.ErrorsOr;
import com.hcltech.typedkafka.kafka.errors.BrokerException;
import com.hcltech.typedkafka.kafka.errors.DeliveryTimeoutException;
import com.hcltech.typedkafka.kafka.errors.PayloadSerializationException;
import com.hcltech.typedkafka.kafkaconfig.ClientRole;
import com.hcltech.typedkafka.kafkaconfig.ConnectionConfig;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Publishes typed payloads to any {@link Topic}. Payloads are encoded with the topic's codec before anything
 * reaches the broker client.
 * <p>
 * Every {@code send} returns a future that completes with the {@link Delivery}, or fails with
 * {@link PayloadSerializationException} when the payload cannot be encoded (nothing is sent) or
 * {@link BrokerException} when the broker client reports a failure. A send with a timeout that elapses first fails
 * with {@link DeliveryTimeoutException}, whose outcome is still pending.
 * Failed sends are never retried here; the broker client's own {@code retries} option governs that.
 * <p>
 * Thread-safe: share one instance.
 */
public final class TypedProducer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TypedProducer.class);

    private static final long NO_TIMEOUT = -1;
    private static final Duration LONGEST_TIMEOUT = Duration.ofMillis(Long.MAX_VALUE);

    private final Producer<byte[], byte[]> producer;

    public TypedProducer(ConnectionConfig config) {
        this(createClient(config));
    }

    /** Wraps an existing client, which this producer then owns and closes. */
    public TypedProducer(Producer<byte[], byte[]> producer) {
        this.producer = Objects.requireNonNull(producer, "producer");
    }

    /** Sends without a key; the broker client picks the partition. */
    public <P> CompletableFuture<Delivery> send(Topic<P> topic, P payload) {
        return send(topic, payload, null, null);
    }

    /** Sends with a key, UTF-8 encoded. Records with the same key land on the same partition. */
    public <P> CompletableFuture<Delivery> send(Topic<P> topic, P payload, String key) {
        return send(topic, payload, Objects.requireNonNull(key, "key"), null);
    }

    /**
     * As {@link #send(Topic, Object, String)} with a bound on how long the caller waits. A null key sends
     * without one, a null timeout waits for the broker client, and so does a timeout too long to express in
     * milliseconds. When the timeout elapses first the future fails with {@link DeliveryTimeoutException}: the
     * outcome is unknown, not failed, and {@link DeliveryTimeoutException#acknowledgement()} reports it once the
     * broker client decides.
     *
     * @throws IllegalArgumentException when the timeout is negative; nothing is sent
     */
    public <P> CompletableFuture<Delivery> send(Topic<P> topic, P payload, String key, Duration timeout) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        long timeoutMillis = timeoutMillis(timeout);
        String topicName = topic.topicName();

        ErrorsOr<byte[]> encoded = topic.codec().encode(payload);
        if (encoded.isError()) {
            log.warn("Failed to encode payload for topic {}: {}", topicName, encoded.getErrors());
            return CompletableFuture.failedFuture(new PayloadSerializationException(
                    "Failed to encode payload for topic " + topicName, encoded.getErrors()));
        }

        byte[] keyBytes = key == null ? null : key.getBytes(StandardCharsets.UTF_8);
        ProducerRecord<byte[], byte[]> record = new ProducerRecord<>(topicName, keyBytes, encoded.valueOrThrow());
        CompletableFuture<Delivery> acknowledged = new CompletableFuture<>();
        try {
            producer.send(record, (metadata, exception) -> {
                if (exception != null) {
                    log.warn("Send to topic {} failed", topicName, exception);
                    acknowledged.completeExceptionally(new BrokerException("Failed to send to topic " + topicName, exception));
                } else {
                    log.debug("Sent to {}-{} at offset {}", metadata.topic(), metadata.partition(), metadata.offset());
                    acknowledged.complete(Delivery.from(metadata));
                }
            });
        } catch (KafkaException | IllegalStateException e) {
            log.warn("Send to topic {} was rejected", topicName, e);
            acknowledged.completeExceptionally(new BrokerException("Failed to send to topic " + topicName, e));
        }
        if (timeoutMillis == NO_TIMEOUT || acknowledged.isDone()) {
            return acknowledged;
        }
        return withTimeout(acknowledged, timeoutMillis, topicName);
    }

    /** Blocks until every record sent so far has completed. */
    public void flush() {
        producer.flush();
    }

    public void close(Duration timeout) {
        producer.close(timeout);
    }

    @Override
    public void close() {
        producer.close();
    }

    private static long timeoutMillis(Duration timeout) {
        if (timeout == null) return NO_TIMEOUT;
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Send timeout must not be negative: " + timeout);
        }
        return timeout.compareTo(LONGEST_TIMEOUT) >= 0 ? NO_TIMEOUT : timeout.toMillis();
    }

    // The caller's future fails on timeout; the acknowledgement is still logged when it arrives.
    private static CompletableFuture<Delivery> withTimeout(CompletableFuture<Delivery> acknowledged, long millis, String topicName) {
        CompletableFuture<Delivery> result = new CompletableFuture<>();
        acknowledged.whenComplete((delivery, failure) -> {
            boolean inTime = failure == null ? result.complete(delivery) : result.completeExceptionally(failure);
            if (!inTime && failure == null) {
                log.warn("Record for topic {} was acknowledged at {}-{} offset {} after the {} ms timeout",
                        topicName, delivery.topicName(), delivery.partition(), delivery.offset(), millis);
            } else if (!inTime) {
                log.warn("Record for topic {} failed after the {} ms timeout", topicName, millis, failure);
            }
        });
        CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS).execute(() ->
                result.completeExceptionally(new DeliveryTimeoutException(
                        "No acknowledgement within " + millis + " ms sending to topic " + topicName + "; outcome unknown",
                        acknowledged)));
        return result;
    }

    private static Producer<byte[], byte[]> createClient(ConnectionConfig config) {
        return KafkaClients.create(config, ClientRole.PRODUCER,
                props -> new KafkaProducer<>(props, new ByteArraySerializer(), new ByteArraySerializer()));
    }
}
