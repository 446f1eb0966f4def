package com.hcltech.typedkafka.kafkaconfig.capabilities;

import com.hcltech.typedkafka.kafkaconfig.OptionSet;
import org.apache.kafka.clients.CommonClientConfigs;

/**
 * Request retry count, for the roles that retry requests on their own (producer and admin).
 * When never set, the option is absent from the built configuration and the client default applies.
 */
public interface RetryOptions<B extends RetryOptions<B>> extends OptionSet<B> {

    default B retries(int count) {
        return set(CommonClientConfigs.RETRIES_CONFIG, count);
    }
}
