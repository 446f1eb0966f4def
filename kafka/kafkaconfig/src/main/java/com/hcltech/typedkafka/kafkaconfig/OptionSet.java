package com.hcltech.typedkafka.kafkaconfig;

import java.util.Map;
import java.util.Objects;

/**
 * The single assignment primitive every option setter writes through.
 * <p>
 * {@code set} records one named option on the configuration under construction and returns the builder,
 * so calls chain. Setting a name again replaces the earlier value. Values are not range checked.
 *
 * @param <B> the concrete builder type returned from every call
 */
public interface OptionSet<B extends OptionSet<B>> {

    B set(String name, Object value);

    default B setAll(Map<String, ?> options) {
        Objects.requireNonNull(options, "options");
        options.forEach(this::set);
        return self();
    }

    B self();

    /** Canonical text for a value: {@link OptionValue}s use their wire value, everything else {@code String.valueOf}. */
    static String toText(Object value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof OptionValue v) return v.wireValue();
        return String.valueOf(value);
    }
}
