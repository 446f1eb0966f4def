package com.hcltech.typedkafka.kafka.errors;

import com.hcltech.typedkafka.kafka.Delivery;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * No acknowledgement arrived within the caller's timeout. The outcome is unknown rather than failed: the record
 * is still with the broker client and may yet be written. {@link #acknowledgement()} completes when the broker
 * client finally reports the outcome.
 */
public final class DeliveryTimeoutException extends BrokerException {
    private final transient CompletableFuture<Delivery> acknowledgement;

    public DeliveryTimeoutException(String message, CompletableFuture<Delivery> acknowledgement) {
        super(message, new TimeoutException(message));
        this.acknowledgement = acknowledgement;
    }

    /** Completes with the delivery, or fails with {@link BrokerException}, once the broker client decides. */
    public CompletableFuture<Delivery> acknowledgement() {
        return acknowledgement;
    }
}
