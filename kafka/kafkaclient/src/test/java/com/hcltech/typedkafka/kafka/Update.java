package com.hcltech.typedkafka.kafka;

/** Example payload for session topics. */
public enum Update {
    THING1,
    THING2
}
