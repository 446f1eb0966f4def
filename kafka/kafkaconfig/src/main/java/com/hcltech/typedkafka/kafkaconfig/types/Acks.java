package com.hcltech.typedkafka.kafkaconfig.types;

import com.hcltech.typedkafka.kafkaconfig.OptionValue;

/** How many replica acknowledgements a produce request waits for. */
public enum Acks implements OptionValue {
    /** Fire and forget. */
    NONE("0"),
    /** The partition leader has written the record. */
    LEADER("1"),
    /** All in-sync replicas have the record. */
    ALL("all");

    private final String wireValue;

    Acks(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
