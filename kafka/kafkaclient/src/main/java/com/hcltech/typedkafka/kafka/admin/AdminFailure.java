package com.hcltech.typedkafka.kafka.admin;

import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.InvalidPartitionsException;
import org.apache.kafka.common.errors.InvalidReplicaAssignmentException;
import org.apache.kafka.common.errors.InvalidReplicationFactorException;
import org.apache.kafka.common.errors.InvalidTopicException;
import org.apache.kafka.common.errors.PolicyViolationException;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.errors.TopicExistsException;

import java.util.Objects;

/** Why the broker refused to create one topic. */
public record AdminFailure(Kind kind, String message) {

    public enum Kind {
        ALREADY_EXISTS,
        INVALID_REPLICATION_FACTOR,
        INVALID_PARTITIONS,
        INVALID_REPLICA_ASSIGNMENT,
        INVALID_TOPIC,
        POLICY_VIOLATION,
        NOT_AUTHORIZED,
        TIMEOUT,
        OTHER
    }

    public AdminFailure {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    static AdminFailure from(Throwable t) {
        String message = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
        return new AdminFailure(kindOf(t), message);
    }

    private static Kind kindOf(Throwable t) {
        if (t instanceof TopicExistsException) return Kind.ALREADY_EXISTS;
        if (t instanceof InvalidReplicationFactorException) return Kind.INVALID_REPLICATION_FACTOR;
        if (t instanceof InvalidPartitionsException) return Kind.INVALID_PARTITIONS;
        if (t instanceof InvalidReplicaAssignmentException) return Kind.INVALID_REPLICA_ASSIGNMENT;
        if (t instanceof InvalidTopicException) return Kind.INVALID_TOPIC;
        if (t instanceof PolicyViolationException) return Kind.POLICY_VIOLATION;
        if (t instanceof AuthorizationException) return Kind.NOT_AUTHORIZED;
        if (t instanceof TimeoutException) return Kind.TIMEOUT;
        return Kind.OTHER;
    }
}
