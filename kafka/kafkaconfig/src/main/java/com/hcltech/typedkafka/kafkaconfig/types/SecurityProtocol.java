package com.hcltech.typedkafka.kafkaconfig.types;

import com.hcltech.typedkafka.kafkaconfig.OptionValue;

public enum SecurityProtocol implements OptionValue {
    PLAINTEXT("PLAINTEXT"),
    SSL("SSL"),
    SASL_PLAINTEXT("SASL_PLAINTEXT"),
    SASL_SSL("SASL_SSL");

    private final String wireValue;

    SecurityProtocol(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
