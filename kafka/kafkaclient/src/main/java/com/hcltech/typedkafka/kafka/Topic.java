package com.hcltech.typedkafka.kafka;

import com.hcltech.typedkafka.common.codec.Codec;

/**
 * Binds a topic name to a payload type and the codec that turns payloads into record values.
 * <p>
 * The name is a method so it can be derived from instance state, e.g. a session topic named
 * {@code "session:" + sessionId}. Implementations should be immutable values; records work well.
 *
 * @param <P> the payload carried by every record on the topic
 */
public interface Topic<P> {

    String topicName();

    Codec<P, byte[]> codec();

    /** A fixed-name topic with JSON payloads. */
    static <P> JsonTopic<P> of(String topicName, Class<P> payloadType) {
        return new NamedJsonTopic<>(topicName, payloadType);
    }
}
