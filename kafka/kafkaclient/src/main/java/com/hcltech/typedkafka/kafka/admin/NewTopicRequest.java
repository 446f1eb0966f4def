package com.hcltech.typedkafka.kafka.admin;

import com.hcltech.typedkafka.kafka.Topic;
import org.apache.kafka.clients.admin.NewTopic;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One topic to create. {@code configs} are topic-level settings such as {@code cleanup.policy}, passed to the
 * broker unchanged.
 */
public record NewTopicRequest(String topicName, int partitions, TopicReplication replication, Map<String, String> configs) {

    public NewTopicRequest {
        Objects.requireNonNull(topicName, "topicName");
        Objects.requireNonNull(replication, "replication");
        configs = Map.copyOf(Objects.requireNonNull(configs, "configs"));
    }

    public static NewTopicRequest of(Topic<?> topic, int partitions, TopicReplication replication) {
        return new NewTopicRequest(topic.topicName(), partitions, replication, Map.of());
    }

    public NewTopicRequest withConfig(String name, String value) {
        Map<String, String> merged = new HashMap<>(configs);
        merged.put(name, value);
        return new NewTopicRequest(topicName, partitions, replication, merged);
    }

    NewTopic toNewTopic() {
        NewTopic newTopic;
        if (replication instanceof TopicReplication.Factor f) {
            newTopic = new NewTopic(topicName, partitions, f.replicationFactor());
        } else if (replication instanceof TopicReplication.Assignments a) {
            newTopic = new NewTopic(topicName, a.replicasByPartition());
        } else {
            newTopic = new NewTopic(topicName, Optional.of(partitions), Optional.empty());
        }
        if (!configs.isEmpty()) newTopic.configs(configs);
        return newTopic;
    }
}
