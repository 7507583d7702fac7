package com.orbit.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A notification emitted by an agent.
 *
 * @param eventType one of the names in {@link AgentEvents}
 * @param agentId   the agent that emitted the event
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record AgentEvent(
    String eventType,
    String agentId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
