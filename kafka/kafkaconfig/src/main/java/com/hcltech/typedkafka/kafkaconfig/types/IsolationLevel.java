package com.hcltech.typedkafka.kafkaconfig.types;

import com.hcltech.typedkafka.kafkaconfig.OptionValue;

/** Which records a consumer reads from partitions written by transactional producers. */
public enum IsolationLevel implements OptionValue {
    READ_UNCOMMITTED("read_uncommitted"),
    READ_COMMITTED("read_committed");

    private final String wireValue;

    IsolationLevel(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
