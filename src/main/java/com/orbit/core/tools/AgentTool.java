package com.orbit.core.tools;

import com.orbit.core.model.ToolResult;

import java.util.Map;

/**
 * An action an agent may perform. Only tools named in the guardrail allow-list can be registered.
 */
public interface AgentTool {

    String name();

    String description();

    ToolResult execute(Map<String, Object> params) throws Exception;
}
