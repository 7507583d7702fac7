package com.orbit.core.agent;

/**
 * Thrown synchronously when a caller asks an agent for something its static
 * configuration forbids, such as registering a tool outside the allow-list.
 */
public class AgentConfigurationException extends RuntimeException {
    public AgentConfigurationException(String message) {
        super(message);
    }
}
