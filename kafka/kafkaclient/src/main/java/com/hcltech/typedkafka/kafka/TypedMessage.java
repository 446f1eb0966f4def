package com.hcltech.typedkafka.kafka;

import com.hcltech.typedkafka.common.errorsor.ErrorsOr;
import com.hcltech.typedkafka.kafka.errors.PayloadSerializationException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.record.TimestampType;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * One received record seen through its topic's payload type. The payload is decoded on each access, so a
 * record that cannot be decoded is still delivered and can be inspected through {@link #rawPayload()}.
 */
public final class TypedMessage<P> {

    private final Topic<P> topic;
    private final ConsumerRecord<byte[], byte[]> record;

    public TypedMessage(Topic<P> topic, ConsumerRecord<byte[], byte[]> record) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.record = Objects.requireNonNull(record, "record");
    }

    public Topic<P> topic() {
        return topic;
    }

    /** The topic the record was read from. */
    public String topicName() {
        return record.topic();
    }

    /** A copy of the key bytes. */
    public Optional<byte[]> key() {
        return Optional.ofNullable(record.key()).map(byte[]::clone);
    }

    public Optional<String> keyAsString() {
        return Optional.ofNullable(record.key()).map(k -> new String(k, StandardCharsets.UTF_8));
    }

    /** A copy of the value bytes; changing it does not change what {@link #payload()} decodes. */
    public Optional<byte[]> rawPayload() {
        return Optional.ofNullable(record.value()).map(byte[]::clone);
    }

    /**
     * Empty only when the record has no value.
     *
     * @throws PayloadSerializationException when the value cannot be decoded into {@code P}
     */
    public Optional<P> payload() {
        ErrorsOr<Optional<P>> decoded = tryPayload();
        if (decoded.isError()) {
            throw new PayloadSerializationException(
                    "Failed to decode payload from " + topicName() + "-" + partition() + " at offset " + offset(),
                    decoded.getErrors());
        }
        return decoded.valueOrThrow();
    }

    public ErrorsOr<Optional<P>> tryPayload() {
        byte[] value = record.value();
        if (value == null) return ErrorsOr.lift(Optional.empty());
        return topic.codec().decode(value).map(Optional::of);
    }

    public int partition() {
        return record.partition();
    }

    public long offset() {
        return record.offset();
    }

    public long timestamp() {
        return record.timestamp();
    }

    public TimestampType timestampType() {
        return record.timestampType();
    }

    /** A read-only copy of the record's headers. */
    public Headers headers() {
        RecordHeaders copy = new RecordHeaders();
        for (Header header : record.headers()) {
            copy.add(header.key(), header.value() == null ? null : header.value().clone());
        }
        copy.setReadOnly();
        return copy;
    }

    /** A copy of the value of the last header called {@code name}. */
    public Optional<byte[]> lastHeader(String name) {
        Header header = record.headers().lastHeader(name);
        return header == null ? Optional.empty() : Optional.ofNullable(header.value()).map(byte[]::clone);
    }

    @Override
    public String toString() {
        return "TypedMessage[" + topicName() + "-" + partition() + "@" + offset() + "]";
    }
}
