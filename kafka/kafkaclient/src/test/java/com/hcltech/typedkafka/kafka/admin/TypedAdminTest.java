package com.hcltech.typedkafka.kafka.admin;

import com.hcltech.typedkafka.kafka.SessionTopic;
import com.hcltech.typedkafka.kafka.Topic;
import com.hcltech.typedkafka.kafka.errors.BrokerException;
import com.hcltech.typedkafka.kafka.errors.ClientConstructionException;
import com.hcltech.typedkafka.kafkaconfig.roles.ConsumerConfigBuilder;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.CreateTopicsOptions;
import org.apache.kafka.clients.admin.CreateTopicsResult;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.errors.InvalidReplicationFactorException;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.internals.KafkaFutureImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

class TypedAdminTest {

    private Admin client;
    private TypedAdmin admin;
    private final Set<String> existing = new HashSet<>();
    private final Map<String, RuntimeException> refusals = new HashMap<>();

    /** Behaves like a cluster that remembers created topics and refuses the names in {@code refusals}. */
    @BeforeEach
    void setUp() {
        client = mock(Admin.class);
        when(client.createTopics(anyCollection(), any(CreateTopicsOptions.class))).thenAnswer(invocation -> {
            Collection<NewTopic> topics = invocation.getArgument(0);
            Map<String, KafkaFuture<Void>> values = new HashMap<>();
            for (NewTopic topic : topics) {
                KafkaFutureImpl<Void> future = new KafkaFutureImpl<>();
                if (refusals.containsKey(topic.name())) {
                    future.completeExceptionally(refusals.get(topic.name()));
                } else if (existing.add(topic.name())) {
                    future.complete(null);
                } else {
                    future.completeExceptionally(new TopicExistsException("Topic '" + topic.name() + "' already exists."));
                }
                values.put(topic.name(), future);
            }
            CreateTopicsResult result = mock(CreateTopicsResult.class);
            when(result.values()).thenReturn(values);
            return result;
        });
        admin = new TypedAdmin(client);
    }

    @Test
    void createsATopic() throws Exception {
        TopicCreationResult result = admin.createTopic(new SessionTopic("abc"), 3, TopicReplication.factor((short) 1))
                .get(5, TimeUnit.SECONDS);

        assertEquals(TopicCreationResult.created("session:abc"), result);
        assertTrue(result.isCreated());
    }

    @Test
    void secondCreateReportsAlreadyExists() throws Exception {
        SessionTopic topic = new SessionTopic("abc");
        admin.createTopic(topic, 1, TopicReplication.factor((short) 1)).get(5, TimeUnit.SECONDS);

        TopicCreationResult second = admin.createTopic(topic, 1, TopicReplication.factor((short) 1)).get(5, TimeUnit.SECONDS);

        assertFalse(second.isCreated());
        assertEquals(AdminFailure.Kind.ALREADY_EXISTS, second.failure().orElseThrow().kind());
        assertTrue(second.failure().orElseThrow().message().contains("already exists"));
    }

    @Test
    void eachTopicSucceedsOrFailsOnItsOwnInRequestOrder() throws Exception {
        refusals.put("bad", new InvalidReplicationFactorException("Replication factor: 9 larger than available brokers: 1."));
        List<NewTopicRequest> requests = List.of(
                new NewTopicRequest("good-1", 1, TopicReplication.factor((short) 1), Map.of()),
                new NewTopicRequest("bad", 1, TopicReplication.factor((short) 9), Map.of()),
                new NewTopicRequest("good-2", 1, TopicReplication.brokerDefault(), Map.of()));

        List<TopicCreationResult> results = admin.createTopics(requests).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("good-1", "bad", "good-2"), results.stream().map(TopicCreationResult::topicName).toList());
        assertTrue(results.get(0).isCreated());
        assertEquals(AdminFailure.Kind.INVALID_REPLICATION_FACTOR, results.get(1).failure().orElseThrow().kind());
        assertTrue(results.get(2).isCreated());
    }

    @Test
    @SuppressWarnings("unchecked")
    void repeatedTopicInOneRequestIsCreatedOnceAndReportedPerRequest() throws Exception {
        List<NewTopicRequest> requests = List.of(
                new NewTopicRequest("orders", 3, TopicReplication.factor((short) 1), Map.of()),
                new NewTopicRequest("audit", 1, TopicReplication.brokerDefault(), Map.of()),
                new NewTopicRequest("orders", 6, TopicReplication.factor((short) 1), Map.of()));

        List<TopicCreationResult> results = admin.createTopics(requests).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("orders", "audit", "orders"), results.stream().map(TopicCreationResult::topicName).toList());
        assertTrue(results.get(0).isCreated());
        assertTrue(results.get(1).isCreated());
        AdminFailure repeat = results.get(2).failure().orElseThrow();
        assertEquals(AdminFailure.Kind.INVALID_TOPIC, repeat.kind());
        assertTrue(repeat.message().contains("more than once"), repeat.message());

        ArgumentCaptor<Collection<NewTopic>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(client).createTopics(captor.capture(), any(CreateTopicsOptions.class));
        List<NewTopic> sent = new ArrayList<>(captor.getValue());
        assertEquals(List.of("orders", "audit"), sent.stream().map(NewTopic::name).toList());
        assertEquals(3, sent.get(0).numPartitions());
    }

    @Test
    void emptyRequestNeedsNoBroker() throws Exception {
        assertEquals(List.of(), admin.createTopics(List.of()).get(5, TimeUnit.SECONDS));
        verifyNoInteractions(client);
    }

    @Test
    @SuppressWarnings("unchecked")
    void requestsAreTranslatedToNewTopics() throws Exception {
        Map<Integer, List<Integer>> assignments = Map.of(0, List.of(1, 2), 1, List.of(2, 3));
        admin.createTopics(List.of(
                NewTopicRequest.of(Topic.of("by-factor", String.class), 6, TopicReplication.factor((short) 3))
                        .withConfig("cleanup.policy", "compact"),
                NewTopicRequest.of(Topic.of("by-assignment", String.class), 99, TopicReplication.assignments(assignments)),
                NewTopicRequest.of(Topic.of("by-default", String.class), 4, TopicReplication.brokerDefault())
        )).get(5, TimeUnit.SECONDS);

        ArgumentCaptor<Collection<NewTopic>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(client).createTopics(captor.capture(), any(CreateTopicsOptions.class));
        List<NewTopic> sent = new ArrayList<>(captor.getValue());

        assertEquals("by-factor", sent.get(0).name());
        assertEquals(6, sent.get(0).numPartitions());
        assertEquals(3, sent.get(0).replicationFactor());
        assertEquals(Map.of("cleanup.policy", "compact"), sent.get(0).configs());

        assertEquals("by-assignment", sent.get(1).name());
        assertEquals(assignments, sent.get(1).replicasAssignments());

        assertEquals("by-default", sent.get(2).name());
        assertEquals(4, sent.get(2).numPartitions());
        assertEquals(-1, sent.get(2).replicationFactor());
    }

    @Test
    void wholeRequestFailureIsABrokerException() {
        reset(client);
        when(client.createTopics(anyCollection(), any(CreateTopicsOptions.class)))
                .thenThrow(new KafkaException("admin client closed"));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> admin.createTopic(new SessionTopic("abc"), 1, TopicReplication.brokerDefault()).get(5, TimeUnit.SECONDS));

        BrokerException broker = assertInstanceOf(BrokerException.class, e.getCause());
        assertEquals("admin client closed", broker.getCause().getMessage());
    }

    @Test
    void closeClosesTheClient() {
        admin.close();
        verify(client).close();
    }

    @Test
    void wrongRoleIsRejected() {
        assertThrows(ClientConstructionException.class,
                () -> new TypedAdmin(new ConsumerConfigBuilder().bootstrapServers("localhost:9092").build()));
    }
}
