package com.hcltech.typedkafka.kafka.errors;

import java.util.List;

/** A payload could not be encoded for, or decoded from, its topic. Carries the codec's error messages. */
public final class PayloadSerializationException extends TypedKafkaException {

    private final List<String> errors;

    public PayloadSerializationException(String message, List<String> errors) {
        super(message + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
