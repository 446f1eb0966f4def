package com.hcltech.typedkafka.common.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcltech.typedkafka.common.errorsor.ErrorsOr;

import java.util.Objects;
import java.util.Optional;

/**
 * JSON text codec for one target type. The mapper is a private copy with every module on the classpath
 * registered (e.g. {@code java.time} support), so a codec is safe to share between threads.
 */
public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectMapper mapper;
    private final JavaType type;

    public JacksonTypedJsonCodec(Class<T> klass) {
        this(new ObjectMapper(), klass);
    }

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, Class<T> klass) {
        this.mapper = copyOf(baseMapper);
        this.type = mapper.constructType(Objects.requireNonNull(klass, "klass"));
    }

    /** For generic targets such as {@code List<Order>}. */
    public JacksonTypedJsonCodec(TypeReference<T> typeRef) {
        this(new ObjectMapper(), typeRef);
    }

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, TypeReference<T> typeRef) {
        this.mapper = copyOf(baseMapper);
        this.type = mapper.constructType(Objects.requireNonNull(typeRef, "typeRef"));
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        return ErrorsOr.trying(() -> mapper.writeValueAsString(value),
                e -> "Failed to encode " + type.getTypeName() + " to JSON: " + e.getMessage());
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        return ErrorsOr.trying(() -> Optional.ofNullable(mapper.<T>readValue(json, type)),
                        e -> "Failed to decode from JSON: " + e.getMessage())
                .flatMap(value -> value.isPresent()
                        ? ErrorsOr.lift(value.get())
                        : ErrorsOr.<T>error("Failed to decode from JSON: document is null"));
    }

    /** The codec's own copy of the mapper it was given. */
    public ObjectMapper objectMapper() {
        return mapper;
    }

    private static ObjectMapper copyOf(ObjectMapper baseMapper) {
        ObjectMapper copy = Objects.requireNonNull(baseMapper, "baseMapper").copy();
        copy.findAndRegisterModules();
        return copy;
    }
}
