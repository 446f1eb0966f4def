package com.hcltech.typedkafka.kafka.admin;

import java.util.Objects;
import java.util.Optional;

public record TopicCreationResult(String topicName, Optional<AdminFailure> failure) {

    public TopicCreationResult {
        Objects.requireNonNull(topicName, "topicName");
        Objects.requireNonNull(failure, "failure");
    }

    public static TopicCreationResult created(String topicName) {
        return new TopicCreationResult(topicName, Optional.empty());
    }

    public static TopicCreationResult failed(String topicName, AdminFailure failure) {
        return new TopicCreationResult(topicName, Optional.of(failure));
    }

    public boolean isCreated() {
        return failure.isEmpty();
    }
}
