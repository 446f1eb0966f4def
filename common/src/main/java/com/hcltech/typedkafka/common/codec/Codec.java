package com.hcltech.typedkafka.common.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hcltech.typedkafka.common.errorsor.ErrorsOr;

public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    static <T> Codec<T, String> clazzCodec(Class<T> klass) {
        return new JacksonTypedJsonCodec<>(klass);
    }

    static <T> Codec<T, String> typeRefCodec(TypeReference<T> typeRef) {
        return new JacksonTypedJsonCodec<>(typeRef);
    }

    static <T> Codec<T, byte[]> bytes(Codec<T, String> stringCodec) {
        return new StringToBytesCodec<>(stringCodec);
    }

}
