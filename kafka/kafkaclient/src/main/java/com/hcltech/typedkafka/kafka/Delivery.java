package com.hcltech.typedkafka.kafka;

import org.apache.kafka.clients.producer.RecordMetadata;

/** Where the broker stored a sent record. Offset and timestamp are -1 when the broker did not report them. */
public record Delivery(String topicName, int partition, long offset, long timestamp) {

    static Delivery from(RecordMetadata metadata) {
        return new Delivery(metadata.topic(), metadata.partition(), metadata.offset(), metadata.timestamp());
    }
}
