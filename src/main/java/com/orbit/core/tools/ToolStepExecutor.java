package com.orbit.core.tools;

import com.orbit.core.model.ExecutionPlan;
import com.orbit.core.model.PlanStep;
import com.orbit.core.model.ToolResult;
import com.orbit.core.planning.ResourceExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a step's required resources to a registered tool and invokes it.
 * <p>
 * Steps that name no registered tool complete immediately as bookkeeping steps.
 * Tool exceptions become failed results.
 */
public class ToolStepExecutor implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolStepExecutor.class);

    private final Clock clock;

    public ToolStepExecutor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolResult execute(ExecutionPlan plan, PlanStep step, Map<String, AgentTool> tools) {
        long started = clock.millis();
        Optional<AgentTool> tool = resolveTool(step, tools);
        if (tool.isEmpty()) {
            log.debug("Step {} needs no tool, completing", step.id());
            return ToolResult.success(step.action(), 0, clock.instant());
        }

        AgentTool selected = tool.get();
        log.info("Running tool {} for step {}", selected.name(), step.id());
        try {
            ToolResult result = selected.execute(Map.of(
                    "planId", plan.id(),
                    "goalId", plan.goal().id(),
                    "stepId", step.id(),
                    "action", step.action()));
            if (result == null) {
                return ToolResult.failure("Tool " + selected.name() + " returned no result",
                        clock.millis() - started, clock.instant());
            }
            return result;
        } catch (Exception e) {
            log.warn("Tool {} failed on step {}: {}", selected.name(), step.id(), e.getMessage());
            return ToolResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                    clock.millis() - started, clock.instant());
        }
    }

    static Optional<AgentTool> resolveTool(PlanStep step, Map<String, AgentTool> tools) {
        for (String resource : ResourceExtractor.requiredResources(step)) {
            for (var entry : tools.entrySet()) {
                if (entry.getKey().toLowerCase(Locale.ROOT).equals(resource)) {
                    return Optional.of(entry.getValue());
                }
            }
        }
        return Optional.empty();
    }
}
