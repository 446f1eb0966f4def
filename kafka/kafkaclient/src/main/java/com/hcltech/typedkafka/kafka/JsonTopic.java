package com.hcltech.typedkafka.kafka;

import com.hcltech.typedkafka.common.codec.Codec;

/** A topic whose payloads are JSON documents, encoded with the shared codec for {@link #payloadType()}. */
public interface JsonTopic<P> extends Topic<P> {

    Class<P> payloadType();

    @Override
    default Codec<P, byte[]> codec() {
        return PayloadCodecs.json(payloadType());
    }
}
