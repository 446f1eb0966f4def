package com.hcltech.typedkafka.kafka;

import java.util.Objects;

record NamedJsonTopic<P>(String topicName, Class<P> payloadType) implements JsonTopic<P> {

    NamedJsonTopic {
        Objects.requireNonNull(topicName, "topicName");
        Objects.requireNonNull(payloadType, "payloadType");
    }
}
