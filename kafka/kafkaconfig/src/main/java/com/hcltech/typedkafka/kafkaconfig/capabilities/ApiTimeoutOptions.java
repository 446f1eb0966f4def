package com.hcltech.typedkafka.kafkaconfig.capabilities;

import com.hcltech.typedkafka.kafkaconfig.OptionSet;
import org.apache.kafka.clients.CommonClientConfigs;

import java.time.Duration;

public interface ApiTimeoutOptions<B extends ApiTimeoutOptions<B>> extends OptionSet<B> {

    /**
     * Timeout for client operations called without an explicit timeout.
     * <p>
     * Default: 60000 ms
     */
    default B defaultApiTimeout(Duration timeout) {
        return set(CommonClientConfigs.DEFAULT_API_TIMEOUT_MS_CONFIG, timeout.toMillis());
    }
}
