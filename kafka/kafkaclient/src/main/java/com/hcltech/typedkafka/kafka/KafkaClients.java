package com.hcltech.typedkafka.kafka;

import com.hcltech.typedkafka.kafka.errors.ClientConstructionException;
import com.hcltech.typedkafka.kafkaconfig.ClientRole;
import com.hcltech.typedkafka.kafkaconfig.ConnectionConfig;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/** Creates underlying Kafka clients from a {@link ConnectionConfig}, checking the configuration's role first. */
public final class KafkaClients {
    private static final Logger log = LoggerFactory.getLogger(KafkaClients.class);

    private KafkaClients() {
    }

    public static <C> C create(ConnectionConfig config, ClientRole role, Function<Properties, C> factory) {
        Objects.requireNonNull(config, "config");
        if (!config.isFor(role)) {
            throw new ClientConstructionException(
                    "Expected a " + role + " configuration but was given a " + config.role() + " configuration");
        }
        String bootstrap = config.get(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG).orElse("<unset>");
        try {
            C client = factory.apply(config.toProperties());
            log.info("Created {} client for bootstrap servers {}", role, bootstrap);
            return client;
        } catch (KafkaException | IllegalArgumentException e) {
            log.warn("Failed to create {} client for bootstrap servers {}", role, bootstrap, e);
            throw new ClientConstructionException("Failed to create " + role + " client: " + e.getMessage(), e);
        }
    }
}
