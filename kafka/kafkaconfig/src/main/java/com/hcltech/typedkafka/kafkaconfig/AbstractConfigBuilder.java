package com.hcltech.typedkafka.kafkaconfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Owns the one configuration under construction for a role builder.
 * <p>
 * A builder is single use: {@link #build()} hands the options over and retires the builder, after which any
 * further {@code set} or {@code build} call throws {@link IllegalStateException}. Builders are not thread-safe.
 */
public abstract class AbstractConfigBuilder<B extends AbstractConfigBuilder<B>> implements OptionSet<B> {

    private final ClientRole role;
    private final Map<String, String> options = new LinkedHashMap<>();
    private boolean built;

    protected AbstractConfigBuilder(ClientRole role) {
        this.role = Objects.requireNonNull(role, "role");
    }

    @Override
    public final B set(String name, Object value) {
        Objects.requireNonNull(name, "name");
        ensureNotBuilt();
        options.put(name, OptionSet.toText(value));
        return self();
    }

    public final ConnectionConfig build() {
        ensureNotBuilt();
        built = true;
        return new ConnectionConfig(role, options);
    }

    public final ClientRole role() {
        return role;
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException(getClass().getSimpleName() + " was already built and cannot be reused");
        }
    }
}
