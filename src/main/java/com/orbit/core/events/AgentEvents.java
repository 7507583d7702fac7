package com.orbit.core.events;

/**
 * Event names published by agents.
 */
public final class AgentEvents {

    public static final String AGENT_STARTED = "agent:started";
    public static final String AGENT_STOPPED = "agent:stopped";
    public static final String STATUS_CHANGED = "status:changed";
    /** Periodic summary, emitted every {@code STATUS_UPDATE_INTERVAL} cycles. */
    public static final String STATUS_UPDATE = "status:update";
    public static final String MESSAGE_SENT = "message:sent";
    public static final String ERROR = "error";
    public static final String GOAL_COMPLETED = "goal:completed";

    public static final int STATUS_UPDATE_INTERVAL = 10;

    private AgentEvents() {}
}
