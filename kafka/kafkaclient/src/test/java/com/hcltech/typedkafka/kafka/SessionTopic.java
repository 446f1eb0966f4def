package com.hcltech.typedkafka.kafka;

/** Example of a topic whose name is computed from its state. */
public record SessionTopic(String sessionId) implements JsonTopic<Update> {

    @Override
    public String topicName() {
        return "session:" + sessionId;
    }

    @Override
    public Class<Update> payloadType() {
        return Update.class;
    }
}
