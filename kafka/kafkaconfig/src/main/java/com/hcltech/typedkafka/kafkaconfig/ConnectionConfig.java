package com.hcltech.typedkafka.kafkaconfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * A finished, immutable set of client options, scoped to the role of the builder that produced it.
 * Options keep the order in which their names were first set.
 */
public record ConnectionConfig(ClientRole role, Map<String, String> options) {

    public ConnectionConfig {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(options, "options");
        options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(options.get(name));
    }

    public boolean contains(String name) {
        return options.containsKey(name);
    }

    /** A fresh copy on every call, safe to hand to a client constructor. */
    public Properties toProperties() {
        Properties p = new Properties();
        p.putAll(options);
        return p;
    }

    public boolean isFor(ClientRole expected) {
        return role == expected;
    }
}
