package com.hcltech.typedkafka.kafkaconfig;

/**
 * An option value with a fixed textual form on the wire, such as {@code SASL_SSL} or {@code earliest}.
 */
public interface OptionValue {
    String wireValue();
}
