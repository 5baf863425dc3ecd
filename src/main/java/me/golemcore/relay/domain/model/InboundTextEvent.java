package me.golemcore.relay.domain.model;

import java.time.Instant;

/**
 * Event published by inbound channel adapters for every plain-text message
 * (slash commands are routed separately).
 *
 * <p>
 * Consumed by the aggregation service, which merges it into the sender's
 * pending request.
 *
 * @since 1.0
 */
public record InboundTextEvent(String channelType, String owner, String text, Instant receivedAt) {
}
