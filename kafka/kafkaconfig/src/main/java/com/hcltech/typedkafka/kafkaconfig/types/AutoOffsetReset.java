package com.hcltech.typedkafka.kafkaconfig.types;

import com.hcltech.typedkafka.kafkaconfig.OptionValue;

/**
 * What a consumer does when its group has no committed offset for a partition, or the committed offset no
 * longer exists on the broker.
 */
public enum AutoOffsetReset implements OptionValue {
    /** Start from the oldest retained record. */
    EARLIEST("earliest"),
    /** Start from the end; only records produced after the reset are seen. */
    LATEST("latest"),
    /** Fail the poll with an error instead of picking a position. */
    NONE("none");

    private final String wireValue;

    AutoOffsetReset(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
