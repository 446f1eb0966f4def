package com.hcltech.typedkafka.kafka;

import com.hcltech.typedkafka.common.errorsor.ErrorsOr;
import com.hcltech.typedkafka.kafka.errors.BrokerException;
import com.hcltech.typedkafka.kafka.errors.ClientConstructionException;
import com.hcltech.typedkafka.kafkaconfig.ClientRole;
import com.hcltech.typedkafka.kafkaconfig.ConnectionConfig;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CancellationException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Receives typed messages from one topic. The subscription is made when the consumer is created and lasts
 * until it is closed.
 * <p>
 * Like the broker client underneath, an instance must be used from one thread; only {@link #wakeup()} may be
 * called from another.
 */
public final class TypedConsumer<P> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TypedConsumer.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    private final Consumer<byte[], byte[]> consumer;
    private final Topic<P> topic;
    private final Duration pollInterval;
    private final Deque<ConsumerRecord<byte[], byte[]>> buffered = new ArrayDeque<>();
    private boolean streamed;

    public TypedConsumer(ConnectionConfig config, Topic<P> topic) {
        this(createClient(config), topic);
    }

    public TypedConsumer(Consumer<byte[], byte[]> consumer, Topic<P> topic) {
        this(consumer, topic, DEFAULT_POLL_INTERVAL);
    }

    /** Wraps an existing client, which this consumer then owns and closes. */
    public TypedConsumer(Consumer<byte[], byte[]> consumer, Topic<P> topic, Duration pollInterval) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        String topicName = topic.topicName();
        try {
            consumer.subscribe(List.of(topicName), new LoggingRebalanceListener(topicName));
        } catch (KafkaException | IllegalArgumentException | IllegalStateException e) {
            consumer.close();
            throw new ClientConstructionException("Failed to subscribe to topic " + topicName + ": " + e.getMessage(), e);
        }
        log.info("Subscribed to topic {}", topicName);
    }

    public Topic<P> topic() {
        return topic;
    }

    /**
     * Blocks until a message is available. Records from one poll are handed out one at a time in the order the
     * broker client returned them.
     *
     * @throws BrokerException       when a poll fails
     * @throws CancellationException when {@link #wakeup()} is called or the thread is interrupted while waiting
     */
    public TypedMessage<P> receive() {
        while (buffered.isEmpty()) {
            pollOnce();
        }
        return new TypedMessage<>(topic, buffered.poll());
    }

    /**
     * An endless lazy stream of received messages, one element per {@link #receive()}, in receive order. A failed
     * poll becomes an error element naming the broker client's exception class, marked {@code retriable} when
     * the broker client says so, and consumption carries on with the next poll. Only one stream may be taken
     * from a consumer.
     */
    public Stream<ErrorsOr<TypedMessage<P>>> stream() {
        if (streamed) {
            throw new IllegalStateException("stream() was already called on this consumer of " + topic.topicName());
        }
        streamed = true;
        Spliterator<ErrorsOr<TypedMessage<P>>> received =
                new Spliterators.AbstractSpliterator<>(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
                    @Override
                    public boolean tryAdvance(java.util.function.Consumer<? super ErrorsOr<TypedMessage<P>>> action) {
                        action.accept(next());
                        return true;
                    }
                };
        return StreamSupport.stream(received, false);
    }

    /** Makes a blocked or the next {@link #receive()} throw {@link CancellationException}. Safe from any thread. */
    public void wakeup() {
        consumer.wakeup();
    }

    @Override
    public void close() {
        log.info("Closing consumer of topic {}", topic.topicName());
        consumer.close();
    }

    private static Consumer<byte[], byte[]> createClient(ConnectionConfig config) {
        return KafkaClients.create(config, ClientRole.CONSUMER,
                props -> new KafkaConsumer<>(props, new ByteArrayDeserializer(), new ByteArrayDeserializer()));
    }

    private ErrorsOr<TypedMessage<P>> next() {
        try {
            return ErrorsOr.lift(receive());
        } catch (BrokerException e) {
            return ErrorsOr.error(describe(e));
        }
    }

    private static String describe(BrokerException e) {
        Throwable cause = e.getCause();
        if (cause == null) return e.getMessage();
        String kind = cause.getClass().getName() + (cause instanceof RetriableException ? ", retriable" : "");
        return e.getMessage() + " [" + kind + "]";
    }

    private void pollOnce() {
        ConsumerRecords<byte[], byte[]> records;
        try {
            records = consumer.poll(pollInterval);
        } catch (WakeupException | InterruptException e) {
            CancellationException cancelled = new CancellationException("Receive from topic " + topic.topicName() + " was cancelled");
            cancelled.initCause(e);
            throw cancelled;
        } catch (KafkaException e) {
            log.warn("Poll of topic {} failed", topic.topicName(), e);
            throw new BrokerException("Failed to poll topic " + topic.topicName() + ": " + e.getMessage(), e);
        }
        for (ConsumerRecord<byte[], byte[]> record : records) {
            buffered.add(record);
        }
        if (!records.isEmpty()) {
            log.debug("Polled {} records from topic {}", records.count(), topic.topicName());
        }
    }

    private record LoggingRebalanceListener(String topicName) implements ConsumerRebalanceListener {

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            log.info("Revoked: {} (topic={})", partitions, topicName);
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            log.info("Assigned: {} (topic={})", partitions, topicName);
        }
    }
}
