package com.orbit.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A message exchanged between agents.
 *
 * @param id        unique identifier
 * @param from      sender agent ID
 * @param to        recipient agent ID, or {@link #BROADCAST}
 * @param type      message type
 * @param content   opaque payload
 * @param timestamp when the message was created
 * @param replyTo   ID of the message this one answers (nullable)
 */
public record AgentMessage(
    String id,
    String from,
    String to,
    Type type,
    Object content,
    Instant timestamp,
    String replyTo
) implements Serializable {

    /** Recipient address that reaches every agent. */
    public static final String BROADCAST = "broadcast";

    public enum Type { REQUEST, RESPONSE, NOTIFICATION, ERROR }
}
