package com.hcltech.typedkafka.kafkaconfig.types;

import com.hcltech.typedkafka.kafkaconfig.OptionValue;

public enum DnsLookup implements OptionValue {
    USE_ALL_DNS_IPS("use_all_dns_ips"),
    RESOLVE_CANONICAL_BOOTSTRAP_SERVERS_ONLY("resolve_canonical_bootstrap_servers_only");

    private final String wireValue;

    DnsLookup(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
