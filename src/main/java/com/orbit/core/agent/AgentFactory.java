package com.orbit.core.agent;

import com.orbit.core.config.AgentProperties;
import com.orbit.core.events.EventBus;
import com.orbit.core.guardrail.HeapUsageProbe;
import com.orbit.core.memory.MemoryStore;
import com.orbit.core.metrics.OrbitMetrics;
import com.orbit.core.planning.HierarchicalPlanningEngine;
import com.orbit.core.time.Sleeper;
import com.orbit.core.tools.AgentTool;
import com.orbit.core.tools.ToolStepExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Builds agents from the configured properties and shared infrastructure beans.
 * Tool beans on the allow-list are registered with every agent; others are skipped.
 */
@Component
public class AgentFactory {

    private static final Logger log = LoggerFactory.getLogger(AgentFactory.class);

    private final AgentProperties properties;
    private final AgentEnvironment environment;
    private final List<AgentTool> tools;

    public AgentFactory(AgentProperties properties, EventBus eventBus, MemoryStore memoryStore,
                        OrbitMetrics metrics, Clock clock, Sleeper sleeper, HeapUsageProbe heapUsageProbe,
                        List<AgentTool> tools) {
        this.properties = properties;
        this.environment = new AgentEnvironment(eventBus, memoryStore, metrics, clock, sleeper, heapUsageProbe);
        this.tools = tools;
    }

    public GoalDrivenAgent createGoalDrivenAgent(List<String> hints) {
        var agent = new GoalDrivenAgent(properties, environment, new ToolStepExecutor(environment.clock()));
        agent.addHints(hints);
        for (AgentTool tool : tools) {
            if (properties.getGuardrails().isToolAllowed(tool.name())) {
                agent.registerTool(tool);
            } else {
                log.debug("Tool {} not in allow-list, skipping", tool.name());
            }
        }
        return agent;
    }

    /**
     * A standalone planning engine with the configured planning capabilities.
     */
    public HierarchicalPlanningEngine createPlanningEngine() {
        return new HierarchicalPlanningEngine(properties.getCapabilities().getPlanning(), environment.clock());
    }

    public AgentProperties properties() {
        return properties;
    }

    public AgentEnvironment environment() {
        return environment;
    }
}
