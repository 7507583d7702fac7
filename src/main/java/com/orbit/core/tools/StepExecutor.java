package com.orbit.core.tools;

import com.orbit.core.model.ExecutionPlan;
import com.orbit.core.model.PlanStep;
import com.orbit.core.model.ToolResult;

import java.util.Map;

/**
 * Runs a single plan step using the agent's registered tools.
 */
@FunctionalInterface
public interface StepExecutor {

    /**
     * @param plan  the plan the step belongs to
     * @param step  the step to run
     * @param tools registered tools keyed by name
     * @return the step result; failures are reported in the result rather than thrown
     */
    ToolResult execute(ExecutionPlan plan, PlanStep step, Map<String, AgentTool> tools);
}
