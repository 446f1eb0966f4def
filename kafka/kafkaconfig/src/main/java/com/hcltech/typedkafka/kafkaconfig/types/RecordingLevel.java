package com.hcltech.typedkafka.kafkaconfig.types;

import com.hcltech.typedkafka.kafkaconfig.OptionValue;

public enum RecordingLevel implements OptionValue {
    INFO("INFO"),
    DEBUG("DEBUG"),
    TRACE("TRACE");

    private final String wireValue;

    RecordingLevel(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
