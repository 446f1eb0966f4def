package com.hcltech.typedkafka.kafka;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcltech.typedkafka.common.codec.Codec;
import com.hcltech.typedkafka.common.errorsor.ErrorsOr;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopicTest {

    record Order(String id, int quantity, Instant placedAt) {
    }

    @Test
    void nameIsComputedFromState() {
        assertEquals("session:abc", new SessionTopic("abc").topicName());
    }

    @Test
    void copiesAreLogicallyIdentical() {
        SessionTopic topic = new SessionTopic("abc");
        SessionTopic copy = new SessionTopic("abc");

        assertEquals(topic, copy);
        assertEquals(topic.topicName(), copy.topicName());
        assertSame(topic.codec(), copy.codec());
    }

    @Test
    void topicOfCreatesFixedNameJsonTopic() {
        JsonTopic<Order> orders = Topic.of("orders", Order.class);

        assertEquals("orders", orders.topicName());
        assertEquals(Order.class, orders.payloadType());
        assertEquals(Topic.of("orders", Order.class), orders);
    }

    @Test
    void topicOfRejectsNulls() {
        assertThrows(NullPointerException.class, () -> Topic.of(null, Order.class));
        assertThrows(NullPointerException.class, () -> Topic.of("orders", null));
    }

    @Test
    void defaultCodecRoundTripsPayloads() {
        Codec<Order, byte[]> codec = Topic.of("orders", Order.class).codec();
        Order order = new Order("o-1", 3, Instant.parse("2024-01-02T03:04:05Z"));

        byte[] bytes = codec.encode(order).valueOrThrow();

        assertTrue(new String(bytes, StandardCharsets.UTF_8).contains("\"id\":\"o-1\""));
        assertEquals(order, codec.decode(bytes).valueOrThrow());
    }

    @Test
    void enumPayloadsAreJsonStrings() {
        byte[] bytes = new SessionTopic("abc").codec().encode(Update.THING1).valueOrThrow();
        assertEquals("\"THING1\"", new String(bytes, StandardCharsets.UTF_8));
    }

    @Test
    void jsonCodecIsSharedPerPayloadClass() {
        assertSame(PayloadCodecs.json(Order.class), PayloadCodecs.json(Order.class));
        assertNotSame(PayloadCodecs.json(Order.class), PayloadCodecs.json(Update.class));
    }

    @Test
    void genericPayloadsUseTypeReference() {
        Codec<List<Update>, byte[]> codec = PayloadCodecs.json(new TypeReference<List<Update>>() {});

        ErrorsOr<List<Update>> decoded = codec.decode("[\"THING1\",\"THING2\"]".getBytes(StandardCharsets.UTF_8));

        assertEquals(List.of(Update.THING1, Update.THING2), decoded.valueOrThrow());
    }

    @Test
    void customMapperCodec() {
        Codec<Order, byte[]> codec = PayloadCodecs.json(new ObjectMapper(), Order.class);
        Order order = new Order("o-2", 1, Instant.parse("2024-05-06T07:08:09Z"));

        assertEquals(order, codec.decode(codec.encode(order).valueOrThrow()).valueOrThrow());
    }

    @Test
    void malformedBytesAreADecodeError() {
        ErrorsOr<Order> decoded = Topic.of("orders", Order.class).codec().decode("not json".getBytes(StandardCharsets.UTF_8));

        assertTrue(decoded.isError());
        assertTrue(decoded.getErrors().get(0).startsWith("Failed to decode from JSON"), decoded.getErrors().toString());
    }
}
