package com.hcltech.typedkafka.kafkaconfig.types;

import com.hcltech.typedkafka.kafkaconfig.OptionValue;

public enum CompressionType implements OptionValue {
    NONE("none"),
    GZIP("gzip"),
    SNAPPY("snappy"),
    LZ4("lz4"),
    ZSTD("zstd");

    private final String wireValue;

    CompressionType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
