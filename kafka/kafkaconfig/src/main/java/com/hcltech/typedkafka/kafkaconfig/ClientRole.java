package com.hcltech.typedkafka.kafkaconfig;

public enum ClientRole {
    PRODUCER,
    CONSUMER,
    ADMIN
}
