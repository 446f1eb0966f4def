package com.hcltech.typedkafka.kafkaconfig.capabilities;

import com.hcltech.typedkafka.kafkaconfig.OptionSet;
import com.hcltech.typedkafka.kafkaconfig.types.DnsLookup;
import com.hcltech.typedkafka.kafkaconfig.types.RecordingLevel;
import com.hcltech.typedkafka.kafkaconfig.types.SecurityProtocol;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.common.config.SecurityConfig;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Connectivity options shared by every client role.
 * <p>
 * Each setter writes one option; the documented default is what the broker client uses when the option is
 * left unset. Durations are sent in milliseconds.
 */
public interface GeneralClientOptions<B extends GeneralClientOptions<B>> extends OptionSet<B> {

    /**
     * Host/port pairs used for the initial connection to the cluster, sent as {@code host1:port1,host2:port2}.
     * The list only seeds discovery; it need not contain every broker.
     * <p>
     * Default: empty
     */
    default B bootstrapServers(String... servers) {
        return bootstrapServers(List.of(servers));
    }

    default B bootstrapServers(Collection<String> servers) {
        return set(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, String.join(",", servers));
    }

    /**
     * How the client uses DNS results when connecting.
     * <p>
     * Default: {@code use_all_dns_ips}
     */
    default B clientDnsLookup(DnsLookup lookup) {
        return set(CommonClientConfigs.CLIENT_DNS_LOOKUP_CONFIG, lookup);
    }

    /**
     * Logical application name sent with every request, so server-side request logs can name the source.
     * <p>
     * Default: empty
     */
    default B clientId(String id) {
        return set(CommonClientConfigs.CLIENT_ID_CONFIG, id);
    }

    /**
     * Close connections that have been idle this long.
     * <p>
     * Default: 540000 ms (9 minutes) for consumers and producers, 300000 ms (5 minutes) for admin clients
     */
    default B connectionsMaxIdle(Duration idle) {
        return set(CommonClientConfigs.CONNECTIONS_MAX_IDLE_MS_CONFIG, idle.toMillis());
    }

    /**
     * Force a metadata refresh after this long even without leadership changes.
     * <p>
     * Default: 300000 ms (5 minutes)
     */
    default B metadataMaxAge(Duration age) {
        return set(CommonClientConfigs.METADATA_MAX_AGE_CONFIG, age.toMillis());
    }

    /**
     * Class names of {@code org.apache.kafka.common.metrics.MetricsReporter} implementations.
     * <p>
     * Default: empty
     */
    default B metricReporters(String... classNames) {
        return set(CommonClientConfigs.METRIC_REPORTER_CLASSES_CONFIG, String.join(",", classNames));
    }

    /** Default: 2 */
    default B metricsNumSamples(int samples) {
        return set(CommonClientConfigs.METRICS_NUM_SAMPLES_CONFIG, samples);
    }

    /** Default: {@code INFO} */
    default B metricsRecordingLevel(RecordingLevel level) {
        return set(CommonClientConfigs.METRICS_RECORDING_LEVEL_CONFIG, level);
    }

    /** Default: 30000 ms */
    default B metricsSampleWindow(Duration window) {
        return set(CommonClientConfigs.METRICS_SAMPLE_WINDOW_MS_CONFIG, window.toMillis());
    }

    /**
     * TCP receive buffer (SO_RCVBUF). -1 uses the OS default.
     * <p>
     * Default: 65536 for consumers, 32768 for producers
     */
    default B receiveBufferBytes(int bytes) {
        return set(CommonClientConfigs.RECEIVE_BUFFER_CONFIG, bytes);
    }

    /**
     * TCP send buffer (SO_SNDBUF). -1 uses the OS default.
     * <p>
     * Default: 131072
     */
    default B sendBufferBytes(int bytes) {
        return set(CommonClientConfigs.SEND_BUFFER_CONFIG, bytes);
    }

    /**
     * Base wait before reconnecting to a host, so a failing host is not hammered in a tight loop.
     * <p>
     * Default: 50 ms
     */
    default B reconnectBackoff(Duration backoff) {
        return set(CommonClientConfigs.RECONNECT_BACKOFF_MS_CONFIG, backoff.toMillis());
    }

    /**
     * Cap for the per-host reconnect backoff, which grows exponentially with consecutive failures and gets
     * 20% random jitter.
     * <p>
     * Default: 1000 ms
     */
    default B reconnectBackoffMax(Duration max) {
        return set(CommonClientConfigs.RECONNECT_BACKOFF_MAX_MS_CONFIG, max.toMillis());
    }

    /**
     * Maximum wait for the response to a single request before it is resent or, once retries run out, failed.
     * <p>
     * Default: 30000 ms
     */
    default B requestTimeout(Duration timeout) {
        return set(CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG, timeout.toMillis());
    }

    /**
     * Wait before retrying a failed request.
     * <p>
     * Default: 100 ms
     */
    default B retryBackoff(Duration backoff) {
        return set(CommonClientConfigs.RETRY_BACKOFF_MS_CONFIG, backoff.toMillis());
    }

    /**
     * Protocol used to talk to brokers.
     * <p>
     * Default: {@code PLAINTEXT}
     */
    default B securityProtocol(SecurityProtocol protocol) {
        return set(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, protocol);
    }

    /**
     * Class names of {@code org.apache.kafka.common.security.auth.SecurityProviderCreator} implementations.
     * <p>
     * Default: none
     */
    default B securityProviders(String... classNames) {
        return set(SecurityConfig.SECURITY_PROVIDERS_CONFIG, String.join(",", classNames));
    }

    /**
     * Wait for a socket connection to be established before the channel is closed.
     * <p>
     * Default: 10000 ms
     */
    default B socketConnectionSetupTimeout(Duration timeout) {
        return set(CommonClientConfigs.SOCKET_CONNECTION_SETUP_TIMEOUT_MS_CONFIG, timeout.toMillis());
    }

    /**
     * Cap for the connection setup timeout, which grows exponentially with consecutive failures.
     * <p>
     * Default: 30000 ms
     */
    default B socketConnectionSetupTimeoutMax(Duration max) {
        return set(CommonClientConfigs.SOCKET_CONNECTION_SETUP_TIMEOUT_MAX_MS_CONFIG, max.toMillis());
    }
}
