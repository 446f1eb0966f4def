package com.hcltech.typedkafka.kafka.admin;

import org.apache.kafka.common.errors.ClusterAuthorizationException;
import org.apache.kafka.common.errors.InvalidPartitionsException;
import org.apache.kafka.common.errors.InvalidReplicaAssignmentException;
import org.apache.kafka.common.errors.InvalidReplicationFactorException;
import org.apache.kafka.common.errors.InvalidTopicException;
import org.apache.kafka.common.errors.PolicyViolationException;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.errors.UnknownServerException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdminFailureTest {

    @Test
    void brokerErrorsMapToKinds() {
        assertEquals(AdminFailure.Kind.ALREADY_EXISTS, AdminFailure.from(new TopicExistsException("x")).kind());
        assertEquals(AdminFailure.Kind.INVALID_REPLICATION_FACTOR, AdminFailure.from(new InvalidReplicationFactorException("x")).kind());
        assertEquals(AdminFailure.Kind.INVALID_PARTITIONS, AdminFailure.from(new InvalidPartitionsException("x")).kind());
        assertEquals(AdminFailure.Kind.INVALID_REPLICA_ASSIGNMENT, AdminFailure.from(new InvalidReplicaAssignmentException("x")).kind());
        assertEquals(AdminFailure.Kind.INVALID_TOPIC, AdminFailure.from(new InvalidTopicException("x")).kind());
        assertEquals(AdminFailure.Kind.POLICY_VIOLATION, AdminFailure.from(new PolicyViolationException("x")).kind());
        assertEquals(AdminFailure.Kind.NOT_AUTHORIZED, AdminFailure.from(new ClusterAuthorizationException("x")).kind());
        assertEquals(AdminFailure.Kind.TIMEOUT, AdminFailure.from(new TimeoutException("x")).kind());
        assertEquals(AdminFailure.Kind.OTHER, AdminFailure.from(new UnknownServerException("x")).kind());
    }

    @Test
    void messageFallsBackToExceptionName() {
        assertEquals("IllegalStateException", AdminFailure.from(new IllegalStateException()).message());
        assertEquals("boom", AdminFailure.from(new IllegalStateException("boom")).message());
    }
}
