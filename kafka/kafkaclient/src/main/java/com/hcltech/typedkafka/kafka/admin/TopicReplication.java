package com.hcltech.typedkafka.kafka.admin;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** How the replicas of a new topic are placed. */
public sealed interface TopicReplication permits TopicReplication.Factor, TopicReplication.Assignments, TopicReplication.BrokerDefault {

    static TopicReplication factor(short replicationFactor) {
        return new Factor(replicationFactor);
    }

    /** Explicit broker ids per partition. The partition count comes from the map, not from the request. */
    static TopicReplication assignments(Map<Integer, List<Integer>> replicasByPartition) {
        return new Assignments(replicasByPartition);
    }

    static TopicReplication brokerDefault() {
        return BrokerDefault.INSTANCE;
    }

    record Factor(short replicationFactor) implements TopicReplication {
    }

    record Assignments(Map<Integer, List<Integer>> replicasByPartition) implements TopicReplication {
        public Assignments {
            Objects.requireNonNull(replicasByPartition, "replicasByPartition");
            replicasByPartition = Map.copyOf(replicasByPartition);
        }
    }

    enum BrokerDefault implements TopicReplication {
        INSTANCE
    }
}
