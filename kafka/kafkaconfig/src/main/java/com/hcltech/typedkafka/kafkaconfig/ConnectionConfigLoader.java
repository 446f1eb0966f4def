package com.hcltech.typedkafka.kafkaconfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Reads client options from {@link Properties}. Keys under a prefix are selected and the prefix stripped, so
 * {@code typedkafka.consumer.group.id} with prefix {@code typedkafka.consumer.} becomes {@code group.id}.
 * The result is meant for {@link OptionSet#setAll(Map)}:
 * <pre>{@code
 * ConnectionConfig config = new ConsumerConfigBuilder()
 *         .setAll(ConnectionConfigLoader.fromProperties(ConnectionConfigLoader.loadResource("kafka.properties"), "consumer."))
 *         .groupId("g1")
 *         .build();
 * }</pre>
 */
public final class ConnectionConfigLoader {

    private ConnectionConfigLoader() {
    }

    public static Map<String, String> fromSystemProps(String prefix) {
        return fromProperties(System.getProperties(), prefix);
    }

    /**
     * Keys are returned in sorted order so repeated loads apply options identically. Values are kept exactly as
     * {@link Properties} parsed them, including trailing whitespace, since passwords and JAAS lines may need it.
     */
    public static Map<String, String> fromProperties(Properties p, String prefix) {
        Objects.requireNonNull(p, "properties");
        Objects.requireNonNull(prefix, "prefix");
        Map<String, String> out = new LinkedHashMap<>();
        for (String key : new TreeSet<>(p.stringPropertyNames())) {
            if (key.startsWith(prefix) && key.length() > prefix.length()) {
                out.put(key.substring(prefix.length()), p.getProperty(key));
            }
        }
        return out;
    }

    /** Loads a {@code .properties} file from the classpath, context class loader first. */
    public static Properties loadResource(String name) {
        Objects.requireNonNull(name, "name");
        String path = name.startsWith("/") ? name.substring(1) : name;
        try (InputStream in = resource(path)) {
            if (in == null) {
                throw new IllegalStateException("Properties resource not found on classpath: " + name);
            }
            Properties p = new Properties();
            p.load(in);
            return p;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read properties resource " + name, e);
        }
    }

    private static InputStream resource(String path) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        InputStream in = (cl != null) ? cl.getResourceAsStream(path) : null;
        if (in == null) in = ConnectionConfigLoader.class.getClassLoader().getResourceAsStream(path);
        return in;
    }
}
