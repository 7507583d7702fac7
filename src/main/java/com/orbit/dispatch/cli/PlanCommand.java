package com.orbit.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orbit.core.agent.AgentFactory;
import com.orbit.core.config.AgentProperties;
import com.orbit.core.model.Goal;
import com.orbit.core.model.PlanningContext;
import com.orbit.core.model.PlanningResult;
import com.orbit.core.planning.PlanningException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * CLI command: orbit plan "&lt;goal&gt;"
 * <p>
 * Plans a single goal with the configured planning capabilities and prints
 * the steps, feasibility and risks without executing anything.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Preview the plan for a goal")
@Component
public class PlanCommand implements Runnable {

    @Parameters(index = "0", description = "Goal description")
    private String description;

    @Option(names = {"--complex", "-c"}, description = "Plan as a complex, multi-step goal")
    private boolean complex;

    @Option(names = {"--priority", "-p"}, description = "Goal priority (default: ${DEFAULT-VALUE})",
            defaultValue = "5")
    private int priority;

    @Option(names = {"--hint"}, description = "Planning hint (repeatable)")
    private List<String> hints = new ArrayList<>();

    @Option(names = {"--resource", "-r"}, description = "Extra available resource (repeatable)")
    private List<String> resources = new ArrayList<>();

    @Option(names = {"--json"}, description = "Print the planning result as JSON")
    private boolean json;

    private final AgentFactory agentFactory;
    private final ObjectMapper objectMapper;

    public PlanCommand(AgentFactory agentFactory, ObjectMapper objectMapper) {
        this.agentFactory = agentFactory;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        AgentProperties properties = agentFactory.properties();
        Set<String> available = new LinkedHashSet<>(properties.getResources());
        available.addAll(properties.getGuardrails().getAllowedTools());
        available.addAll(resources);

        Instant now = agentFactory.environment().clock().instant();
        Goal goal = complex ? Goal.complex(description, priority, now) : Goal.immediate(description, priority, now);
        var context = new PlanningContext(List.of(goal), List.copyOf(available),
                properties.getPlanConstraints().toPlanConstraints());

        PlanningResult result;
        try {
            result = agentFactory.createPlanningEngine().createPlan(context, hints);
        } catch (PlanningException e) {
            ConsoleOutput.error("Planning failed: " + e.getMessage());
            return;
        }

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Could not serialize plan: " + e.getOriginalMessage());
            }
            return;
        }

        ConsoleOutput.printBanner();
        ConsoleOutput.plan(result);
    }
}
