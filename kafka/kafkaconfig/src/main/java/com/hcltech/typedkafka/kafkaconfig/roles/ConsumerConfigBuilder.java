package com.hcltech.typedkafka.kafkaconfig.roles;

import com.hcltech.typedkafka.kafkaconfig.AbstractConfigBuilder;
import com.hcltech.typedkafka.kafkaconfig.ClientRole;
import com.hcltech.typedkafka.kafkaconfig.capabilities.ApiTimeoutOptions;
import com.hcltech.typedkafka.kafkaconfig.capabilities.GeneralClientOptions;
import com.hcltech.typedkafka.kafkaconfig.capabilities.SaslOptions;
import com.hcltech.typedkafka.kafkaconfig.capabilities.TlsOptions;
import com.hcltech.typedkafka.kafkaconfig.types.AutoOffsetReset;
import com.hcltech.typedkafka.kafkaconfig.types.IsolationLevel;
import org.apache.kafka.clients.consumer.ConsumerConfig;

import java.time.Duration;

/**
 * Options for a consumer: general, TLS, SASL and API timeout groups plus group membership and fetch tuning.
 */
public final class ConsumerConfigBuilder extends AbstractConfigBuilder<ConsumerConfigBuilder>
        implements GeneralClientOptions<ConsumerConfigBuilder>,
        TlsOptions<ConsumerConfigBuilder>,
        SaslOptions<ConsumerConfigBuilder>,
        ApiTimeoutOptions<ConsumerConfigBuilder> {

    public ConsumerConfigBuilder() {
        super(ClientRole.CONSUMER);
    }

    @Override
    public ConsumerConfigBuilder self() {
        return this;
    }

    /** Consumer group this client joins. Required for subscription based consumption. */
    public ConsumerConfigBuilder groupId(String groupId) {
        return set(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    }

    /** Static membership id; a restart with the same id does not trigger a rebalance. */
    public ConsumerConfigBuilder groupInstanceId(String instanceId) {
        return set(ConsumerConfig.GROUP_INSTANCE_ID_CONFIG, instanceId);
    }

    /** Default: {@code latest} */
    public ConsumerConfigBuilder autoOffsetReset(AutoOffsetReset reset) {
        return set(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, reset);
    }

    /** Default: true */
    public ConsumerConfigBuilder enableAutoCommit(boolean enable) {
        return set(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, enable);
    }

    /** Default: 5000 ms */
    public ConsumerConfigBuilder autoCommitInterval(Duration interval) {
        return set(ConsumerConfig.AUTO_COMMIT_INTERVAL_MS_CONFIG, interval.toMillis());
    }

    /** Default: 45000 ms */
    public ConsumerConfigBuilder sessionTimeout(Duration timeout) {
        return set(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, timeout.toMillis());
    }

    /**
     * Should stay well below the session timeout, typically no more than a third of it.
     * <p>
     * Default: 3000 ms
     */
    public ConsumerConfigBuilder heartbeatInterval(Duration interval) {
        return set(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, interval.toMillis());
    }

    /** Default: 300000 ms */
    public ConsumerConfigBuilder maxPollInterval(Duration interval) {
        return set(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, interval.toMillis());
    }

    /** Default: 500 */
    public ConsumerConfigBuilder maxPollRecords(int records) {
        return set(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, records);
    }

    /** Default: 1 */
    public ConsumerConfigBuilder fetchMinBytes(int bytes) {
        return set(ConsumerConfig.FETCH_MIN_BYTES_CONFIG, bytes);
    }

    /** Default: 52428800 */
    public ConsumerConfigBuilder fetchMaxBytes(int bytes) {
        return set(ConsumerConfig.FETCH_MAX_BYTES_CONFIG, bytes);
    }

    /** Default: 500 ms */
    public ConsumerConfigBuilder fetchMaxWait(Duration wait) {
        return set(ConsumerConfig.FETCH_MAX_WAIT_MS_CONFIG, wait.toMillis());
    }

    /** Default: 1048576 */
    public ConsumerConfigBuilder maxPartitionFetchBytes(int bytes) {
        return set(ConsumerConfig.MAX_PARTITION_FETCH_BYTES_CONFIG, bytes);
    }

    /** Default: true */
    public ConsumerConfigBuilder allowAutoCreateTopics(boolean allow) {
        return set(ConsumerConfig.ALLOW_AUTO_CREATE_TOPICS_CONFIG, allow);
    }

    /** Default: true */
    public ConsumerConfigBuilder excludeInternalTopics(boolean exclude) {
        return set(ConsumerConfig.EXCLUDE_INTERNAL_TOPICS_CONFIG, exclude);
    }

    /** Default: {@code read_uncommitted} */
    public ConsumerConfigBuilder isolationLevel(IsolationLevel level) {
        return set(ConsumerConfig.ISOLATION_LEVEL_CONFIG, level);
    }
}
