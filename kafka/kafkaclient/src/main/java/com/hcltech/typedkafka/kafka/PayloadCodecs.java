package com.hcltech.typedkafka.kafka;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcltech.typedkafka.common.codec.Codec;
import com.hcltech.typedkafka.common.codec.JacksonTypedJsonCodec;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Payload to record-value codecs: JSON text as UTF-8 bytes. */
public final class PayloadCodecs {

    private static final Map<Class<?>, Codec<?, byte[]>> JSON_BY_TYPE = new ConcurrentHashMap<>();

    private PayloadCodecs() {
    }

    /** Shared per payload class. */
    @SuppressWarnings("unchecked")
    public static <P> Codec<P, byte[]> json(Class<P> payloadType) {
        return (Codec<P, byte[]>) JSON_BY_TYPE.computeIfAbsent(payloadType, t -> Codec.bytes(Codec.clazzCodec(t)));
    }

    /** For generic payloads such as {@code List<Update>}. Not cached. */
    public static <P> Codec<P, byte[]> json(TypeReference<P> payloadType) {
        return Codec.bytes(Codec.typeRefCodec(payloadType));
    }

    /** Uses a copy of the given mapper, so its modules and features apply. Not cached. */
    public static <P> Codec<P, byte[]> json(ObjectMapper mapper, Class<P> payloadType) {
        return Codec.bytes(new JacksonTypedJsonCodec<>(mapper, payloadType));
    }
}
