package com.hcltech.typedkafka.kafkaconfig.roles;

import com.hcltech.typedkafka.kafkaconfig.AbstractConfigBuilder;
import com.hcltech.typedkafka.kafkaconfig.ClientRole;
import com.hcltech.typedkafka.kafkaconfig.capabilities.GeneralClientOptions;
import com.hcltech.typedkafka.kafkaconfig.capabilities.RetryOptions;
import com.hcltech.typedkafka.kafkaconfig.capabilities.SaslOptions;
import com.hcltech.typedkafka.kafkaconfig.capabilities.TlsOptions;
import com.hcltech.typedkafka.kafkaconfig.types.Acks;
import com.hcltech.typedkafka.kafkaconfig.types.CompressionType;
import org.apache.kafka.clients.producer.ProducerConfig;

import java.time.Duration;

/**
 * Options for a producer: general, TLS, SASL and retry groups plus the producer-only settings below.
 * <pre>{@code
 * ConnectionConfig config = new ProducerConfigBuilder()
 *         .bootstrapServers("localhost:9092")
 *         .acks(Acks.ALL)
 *         .build();
 * }</pre>
 */
public final class ProducerConfigBuilder extends AbstractConfigBuilder<ProducerConfigBuilder>
        implements GeneralClientOptions<ProducerConfigBuilder>,
        TlsOptions<ProducerConfigBuilder>,
        SaslOptions<ProducerConfigBuilder>,
        RetryOptions<ProducerConfigBuilder> {

    public ProducerConfigBuilder() {
        super(ClientRole.PRODUCER);
    }

    @Override
    public ProducerConfigBuilder self() {
        return this;
    }

    /** Default: {@code all} */
    public ProducerConfigBuilder acks(Acks acks) {
        return set(ProducerConfig.ACKS_CONFIG, acks);
    }

    /** Default: 5 ms */
    public ProducerConfigBuilder linger(Duration linger) {
        return set(ProducerConfig.LINGER_MS_CONFIG, linger.toMillis());
    }

    /** Default: 16384 */
    public ProducerConfigBuilder batchSize(int bytes) {
        return set(ProducerConfig.BATCH_SIZE_CONFIG, bytes);
    }

    /** Default: {@code none} */
    public ProducerConfigBuilder compressionType(CompressionType type) {
        return set(ProducerConfig.COMPRESSION_TYPE_CONFIG, type);
    }

    /** Default: true, provided no conflicting option is set */
    public ProducerConfigBuilder enableIdempotence(boolean enable) {
        return set(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, enable);
    }

    /**
     * Upper bound on the time between {@code send} returning and the success or failure being reported.
     * Must be at least linger plus request timeout.
     * <p>
     * Default: 120000 ms
     */
    public ProducerConfigBuilder deliveryTimeout(Duration timeout) {
        return set(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, timeout.toMillis());
    }

    /** Default: 5 */
    public ProducerConfigBuilder maxInFlightRequestsPerConnection(int requests) {
        return set(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, requests);
    }

    /**
     * How long {@code send} may block waiting for metadata or buffer space.
     * <p>
     * Default: 60000 ms
     */
    public ProducerConfigBuilder maxBlock(Duration maxBlock) {
        return set(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlock.toMillis());
    }
}
