package com.logpipeline.common.queue;

/**
 * A payload leased by one consumer. It stays on that consumer's processing list
 * until it is acknowledged, released or dead-lettered.
 */
public record Delivery(String consumer, String payload) {
}
