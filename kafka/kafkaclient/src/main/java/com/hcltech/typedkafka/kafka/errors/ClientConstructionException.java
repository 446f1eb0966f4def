package com.hcltech.typedkafka.kafka.errors;

/** The underlying client could not be created from its configuration. Not worth retrying with the same options. */
public final class ClientConstructionException extends TypedKafkaException {

    public ClientConstructionException(String message) {
        super(message);
    }

    public ClientConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
