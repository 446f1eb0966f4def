package com.hcltech.typedkafka.kafkaconfig.capabilities;

import com.hcltech.typedkafka.kafkaconfig.OptionSet;
import org.apache.kafka.common.config.SslConfigs;

/**
 * TLS key material and protocol options. Only read by the client when the security protocol is {@code SSL}
 * or {@code SASL_SSL}.
 */
public interface TlsOptions<B extends TlsOptions<B>> extends OptionSet<B> {

    /** Password of the private key in the key store, or of the PEM key in {@code ssl.keystore.key}. */
    default B sslKeyPassword(String password) {
        return set(SslConfigs.SSL_KEY_PASSWORD_CONFIG, password);
    }

    /** PEM certificate chain (X.509) for the client certificate. */
    default B sslKeystoreCertificateChain(String pemChain) {
        return set(SslConfigs.SSL_KEYSTORE_CERTIFICATE_CHAIN_CONFIG, pemChain);
    }

    /** PEM private key (PKCS#8). */
    default B sslKeystoreKey(String pemKey) {
        return set(SslConfigs.SSL_KEYSTORE_KEY_CONFIG, pemKey);
    }

    default B sslKeystoreLocation(String path) {
        return set(SslConfigs.SSL_KEYSTORE_LOCATION_CONFIG, path);
    }

    default B sslKeystorePassword(String password) {
        return set(SslConfigs.SSL_KEYSTORE_PASSWORD_CONFIG, password);
    }

    /** Default: {@code JKS} */
    default B sslKeystoreType(String type) {
        return set(SslConfigs.SSL_KEYSTORE_TYPE_CONFIG, type);
    }

    /** PEM trusted certificates. */
    default B sslTruststoreCertificates(String pemCertificates) {
        return set(SslConfigs.SSL_TRUSTSTORE_CERTIFICATES_CONFIG, pemCertificates);
    }

    default B sslTruststoreLocation(String path) {
        return set(SslConfigs.SSL_TRUSTSTORE_LOCATION_CONFIG, path);
    }

    default B sslTruststorePassword(String password) {
        return set(SslConfigs.SSL_TRUSTSTORE_PASSWORD_CONFIG, password);
    }

    /** Default: {@code JKS} */
    default B sslTruststoreType(String type) {
        return set(SslConfigs.SSL_TRUSTSTORE_TYPE_CONFIG, type);
    }

    /**
     * Host name verification algorithm. An empty string turns verification off.
     * <p>
     * Default: {@code https}
     */
    default B sslEndpointIdentificationAlgorithm(String algorithm) {
        return set(SslConfigs.SSL_ENDPOINT_IDENTIFICATION_ALGORITHM_CONFIG, algorithm);
    }

    /** Default: {@code TLSv1.3} on JDKs that support it */
    default B sslProtocol(String protocol) {
        return set(SslConfigs.SSL_PROTOCOL_CONFIG, protocol);
    }

    default B sslEnabledProtocols(String... protocols) {
        return set(SslConfigs.SSL_ENABLED_PROTOCOLS_CONFIG, String.join(",", protocols));
    }
}
