package com.hcltech.typedkafka.common.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JacksonTypedJsonCodecTest {

    record Person(String name, int age) {}

    record Stamped(String id, Instant at) {}

    enum Update {Thing1, Thing2}

    /** Bean whose getter throws to force encode failure without subclassing ObjectMapper. */
    static class BadBean {
        public String getExplode() {
            throw new RuntimeException("boom-write");
        }
    }

    @Test
    void roundTrip_record() {
        JacksonTypedJsonCodec<Person> c = new JacksonTypedJsonCodec<>(Person.class);
        Person alice = new Person("Alice", 42);

        String json = c.encode(alice).valueOrThrow();
        assertTrue(json.contains("\"name\":\"Alice\""));
        assertTrue(json.contains("\"age\":42"));
        assertEquals(alice, c.decode(json).valueOrThrow());
    }

    @Test
    void roundTrip_enum_asItsName() {
        JacksonTypedJsonCodec<Update> c = new JacksonTypedJsonCodec<>(Update.class);

        assertEquals("\"Thing1\"", c.encode(Update.Thing1).valueOrThrow());
        assertEquals(Update.Thing2, c.decode("\"Thing2\"").valueOrThrow());
    }

    @Test
    void roundTrip_javaTime_throughRegisteredModules() {
        JacksonTypedJsonCodec<Stamped> c = new JacksonTypedJsonCodec<>(Stamped.class);
        Stamped s = new Stamped("a", Instant.parse("2024-05-01T10:15:30Z"));

        assertEquals(s, c.decode(c.encode(s).valueOrThrow()).valueOrThrow());
    }

    @Test
    void roundTrip_generic_via_TypeReference() {
        JacksonTypedJsonCodec<List<Person>> c =
                new JacksonTypedJsonCodec<>(new TypeReference<List<Person>>() {});

        List<Person> people = List.of(new Person("Alice", 42), new Person("Bob", 30));
        assertEquals(people, c.decode(c.encode(people).valueOrThrow()).valueOrThrow());
    }

    @Test
    void objectMapper_returns_copy_not_same_instance() {
        ObjectMapper base = new ObjectMapper();
        JacksonTypedJsonCodec<Person> c = new JacksonTypedJsonCodec<>(base, Person.class);

        assertNotSame(base, c.objectMapper(), "Codec should copy the provided ObjectMapper");
    }

    @Test
    void decode_with_bad_json_returns_error() {
        var result = new JacksonTypedJsonCodec<>(Person.class).decode("{ this is not valid json");

        assertTrue(result.isError());
        assertTrue(result.getErrors().get(0).startsWith("Failed to decode from JSON"));
    }

    @Test
    void decode_with_type_mismatch_returns_error() {
        var result = new JacksonTypedJsonCodec<>(Person.class).decode("{\"name\":\"Dave\",\"age\":\"old\"}");
        assertThrows(IllegalStateException.class, result::valueOrThrow);
    }

    @Test
    void decode_of_json_null_is_an_error_not_a_value() {
        var result = new JacksonTypedJsonCodec<>(Person.class).decode("null");
        assertTrue(result.isError());
    }

    @Test
    void encode_failure_is_wrapped_in_error() {
        var result = new JacksonTypedJsonCodec<>(BadBean.class).encode(new BadBean());

        assertTrue(result.isError());
        assertTrue(result.getErrors().get(0).contains("boom-write"));
    }

    @Test
    void constructors_validate_null_arguments() {
        assertThrows(NullPointerException.class, () -> new JacksonTypedJsonCodec<>((ObjectMapper) null, Person.class));
        assertThrows(NullPointerException.class, () -> new JacksonTypedJsonCodec<>((Class<Person>) null));
        assertThrows(NullPointerException.class, () -> new JacksonTypedJsonCodec<>((TypeReference<List<Person>>) null));
    }
}
