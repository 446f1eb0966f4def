package com.hcltech.typedkafka.kafka.admin;

import com.hcltech.typedkafka.kafka.KafkaClients;
import com.hcltech.typedkafka.kafka.Topic;
import com.hcltech.typedkafka.kafka.errors.BrokerException;
import com.hcltech.typedkafka.kafkaconfig.ClientRole;
import com.hcltech.typedkafka.kafkaconfig.ConnectionConfig;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.CreateTopicsOptions;
import org.apache.kafka.clients.admin.CreateTopicsResult;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.KafkaFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Creates topics. Each topic in a request succeeds or fails on its own and the outcome is reported as a
 * {@link TopicCreationResult}; creating a topic that already exists is reported as
 * {@link AdminFailure.Kind#ALREADY_EXISTS}. Only a failure of the whole request fails the returned future,
 * with {@link BrokerException}.
 */
public final class TypedAdmin implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TypedAdmin.class);

    private final Admin admin;

    public TypedAdmin(ConnectionConfig config) {
        this(createClient(config));
    }

    public TypedAdmin(Admin admin) {
        this.admin = Objects.requireNonNull(admin, "admin");
    }

    public CompletableFuture<TopicCreationResult> createTopic(Topic<?> topic, int partitions, TopicReplication replication) {
        return createTopics(List.of(NewTopicRequest.of(topic, partitions, replication)))
                .thenApply(results -> results.get(0));
    }

    /**
     * One result per request, in request order. A topic named more than once is sent to the broker once; each
     * repeat is reported as {@link AdminFailure.Kind#INVALID_TOPIC} without reaching the broker.
     */
    public CompletableFuture<List<TopicCreationResult>> createTopics(List<NewTopicRequest> requests) {
        Objects.requireNonNull(requests, "requests");
        if (requests.isEmpty()) return CompletableFuture.completedFuture(List.of());

        Set<String> names = new HashSet<>();
        List<Boolean> repeats = new ArrayList<>();
        List<NewTopic> newTopics = new ArrayList<>();
        for (NewTopicRequest request : requests) {
            boolean first = names.add(request.topicName());
            repeats.add(!first);
            if (first) newTopics.add(request.toNewTopic());
        }

        Map<String, KafkaFuture<Void>> futures;
        try {
            CreateTopicsResult result = admin.createTopics(newTopics, new CreateTopicsOptions());
            futures = result.values();
        } catch (KafkaException e) {
            log.warn("Create topics request for {} failed", newTopics, e);
            return CompletableFuture.failedFuture(new BrokerException("Failed to create topics: " + e.getMessage(), e));
        }

        List<CompletableFuture<TopicCreationResult>> each = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            String topicName = requests.get(i).topicName();
            each.add(repeats.get(i) ? repeated(topicName) : outcome(topicName, futures.get(topicName)));
        }
        return CompletableFuture.allOf(each.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> each.stream().map(CompletableFuture::join).toList());
    }

    public void close(Duration timeout) {
        admin.close(timeout);
    }

    @Override
    public void close() {
        admin.close();
    }

    private static Admin createClient(ConnectionConfig config) {
        return KafkaClients.create(config, ClientRole.ADMIN, props -> Admin.create(props));
    }

    private static CompletableFuture<TopicCreationResult> repeated(String topicName) {
        log.warn("Topic {} appears more than once in one create request", topicName);
        return CompletableFuture.completedFuture(TopicCreationResult.failed(topicName,
                new AdminFailure(AdminFailure.Kind.INVALID_TOPIC, "Topic " + topicName + " appears more than once in the request")));
    }

    private static CompletableFuture<TopicCreationResult> outcome(String topicName, KafkaFuture<Void> future) {
        if (future == null) {
            return CompletableFuture.completedFuture(TopicCreationResult.failed(topicName,
                    new AdminFailure(AdminFailure.Kind.OTHER, "No result was returned for topic " + topicName)));
        }
        return future.toCompletionStage()
                .handle((ignored, e) -> {
                    if (e == null) {
                        log.info("Created topic {}", topicName);
                        return TopicCreationResult.created(topicName);
                    }
                    AdminFailure failure = AdminFailure.from(unwrap(e));
                    log.warn("Could not create topic {}: {} {}", topicName, failure.kind(), failure.message());
                    return TopicCreationResult.failed(topicName, failure);
                })
                .toCompletableFuture();
    }

    private static Throwable unwrap(Throwable e) {
        Throwable t = e;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
