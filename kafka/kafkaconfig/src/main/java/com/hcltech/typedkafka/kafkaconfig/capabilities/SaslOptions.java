package com.hcltech.typedkafka.kafkaconfig.capabilities;

import com.hcltech.typedkafka.kafkaconfig.OptionSet;
import org.apache.kafka.common.config.SaslConfigs;

/**
 * SASL authentication options. Only read by the client when the security protocol is {@code SASL_PLAINTEXT}
 * or {@code SASL_SSL}.
 */
public interface SaslOptions<B extends SaslOptions<B>> extends OptionSet<B> {

    String PLAIN_LOGIN_MODULE = "org.apache.kafka.common.security.plain.PlainLoginModule";

    /** Default: {@code GSSAPI} */
    default B saslMechanism(String mechanism) {
        return set(SaslConfigs.SASL_MECHANISM, mechanism);
    }

    /** JAAS login context line, e.g. {@code <LoginModule> required key="value";}. */
    default B saslJaasConfig(String jaasConfig) {
        return set(SaslConfigs.SASL_JAAS_CONFIG, jaasConfig);
    }

    default B saslKerberosServiceName(String serviceName) {
        return set(SaslConfigs.SASL_KERBEROS_SERVICE_NAME, serviceName);
    }

    default B saslLoginCallbackHandlerClass(String className) {
        return set(SaslConfigs.SASL_LOGIN_CALLBACK_HANDLER_CLASS, className);
    }

    default B saslClientCallbackHandlerClass(String className) {
        return set(SaslConfigs.SASL_CLIENT_CALLBACK_HANDLER_CLASS, className);
    }

    /** Sets mechanism {@code PLAIN} and the matching JAAS line. Quotes and backslashes in the credentials are escaped. */
    default B saslPlain(String username, String password) {
        saslMechanism("PLAIN");
        return saslJaasConfig(PLAIN_LOGIN_MODULE + " required username=\"" + escapeJaas(username)
                + "\" password=\"" + escapeJaas(password) + "\";");
    }

    private static String escapeJaas(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
