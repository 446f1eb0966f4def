package com.hcltech.typedkafka.kafka.errors;

/** Root of every failure reported by the typed clients. */
public abstract class TypedKafkaException extends RuntimeException {

    protected TypedKafkaException(String message) {
        super(message);
    }

    protected TypedKafkaException(String message, Throwable cause) {
        super(message, cause);
    }
}
