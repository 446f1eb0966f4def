package com.hcltech.typedkafka.kafka.errors;

public class BrokerException extends TypedKafkaException {

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }

    public BrokerException(String message) {
        super(message);
    }
}
