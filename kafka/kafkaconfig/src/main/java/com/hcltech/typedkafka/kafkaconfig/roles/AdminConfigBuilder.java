package com.hcltech.typedkafka.kafkaconfig.roles;

import com.hcltech.typedkafka.kafkaconfig.AbstractConfigBuilder;
import com.hcltech.typedkafka.kafkaconfig.ClientRole;
import com.hcltech.typedkafka.kafkaconfig.capabilities.ApiTimeoutOptions;
import com.hcltech.typedkafka.kafkaconfig.capabilities.GeneralClientOptions;
import com.hcltech.typedkafka.kafkaconfig.capabilities.RetryOptions;
import com.hcltech.typedkafka.kafkaconfig.capabilities.SaslOptions;
import com.hcltech.typedkafka.kafkaconfig.capabilities.TlsOptions;

/** Options for an admin client. Carries every capability group and nothing role specific. */
public final class AdminConfigBuilder extends AbstractConfigBuilder<AdminConfigBuilder>
        implements GeneralClientOptions<AdminConfigBuilder>,
        TlsOptions<AdminConfigBuilder>,
        SaslOptions<AdminConfigBuilder>,
        ApiTimeoutOptions<AdminConfigBuilder>,
        RetryOptions<AdminConfigBuilder> {

    public AdminConfigBuilder() {
        super(ClientRole.ADMIN);
    }

    @Override
    public AdminConfigBuilder self() {
        return this;
    }
}
