package com.acme.delivery;

import io.micronaut.runtime.Micronaut;

/**
 * Delivery Application - runs the dead letter retry scheduler against Redis. Business workers
 * admit failed jobs through DeadLetterQueueService; re-deliveries are pushed back onto the origin
 * queue. Instances can run side by side; claim markers keep re-deliveries exclusive.
 */
public class DeliveryApplication {
    public static void main(String[] args) {
        Micronaut.run(DeliveryApplication.class, args);
    }
}
