package com.orbit.dispatch.cli;

import com.orbit.core.agent.AgentFactory;
import com.orbit.core.agent.GoalDrivenAgent;
import com.orbit.core.events.EventBus;
import com.orbit.core.model.Goal;
import com.orbit.core.time.Sleeper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: orbit run --goal "&lt;goal&gt;" [--complex "&lt;goal&gt;"] [--hint "&lt;hint&gt;"]
 * <p>
 * Starts a goal-driven agent, streams its events and stops it once every goal
 * is done or the time limit passes.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run an agent on one or more goals")
@Component
public class RunCommand implements Runnable {

    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    @Option(names = {"--goal", "-g"}, description = "Immediate goal (repeatable)")
    private List<String> goals = new ArrayList<>();

    @Option(names = {"--complex", "-c"}, description = "Complex goal (repeatable)")
    private List<String> complexGoals = new ArrayList<>();

    @Option(names = {"--hint"}, description = "Planning hint (repeatable)")
    private List<String> hints = new ArrayList<>();

    @Option(names = {"--priority", "-p"}, description = "Priority for all goals (default: ${DEFAULT-VALUE})",
            defaultValue = "5")
    private int priority;

    @Option(names = {"--duration", "-d"}, description = "Time limit in ms (default: ${DEFAULT-VALUE})",
            defaultValue = "30000")
    private long duration;

    @Option(names = {"--poll"}, hidden = true, defaultValue = "100")
    private long pollInterval;

    private final AgentFactory agentFactory;
    private final EventBus eventBus;
    private final Clock clock;
    private final Sleeper sleeper;

    public RunCommand(AgentFactory agentFactory, EventBus eventBus, Clock clock, Sleeper sleeper) {
        this.agentFactory = agentFactory;
        this.eventBus = eventBus;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (goals.isEmpty() && complexGoals.isEmpty()) {
            ConsoleOutput.error("No goals given. Use --goal or --complex.");
            return;
        }

        GoalDrivenAgent agent = agentFactory.createGoalDrivenAgent(hints);
        var subscription = eventBus.subscribe(agent.getId(), ConsoleOutput::event);
        goals.forEach(d -> agent.addGoal(Goal.immediate(d, priority, clock.instant())));
        complexGoals.forEach(d -> agent.addGoal(Goal.complex(d, priority, clock.instant())));

        ConsoleOutput.info("Agent " + agent.getId() + " working on "
                + (goals.size() + complexGoals.size()) + " goal(s)");
        agent.start();

        long deadline = clock.millis() + duration;
        try {
            while (!agent.getState().currentGoals().isEmpty()
                    && agent.isRunning()
                    && clock.millis() < deadline) {
                sleeper.sleep(pollInterval);
            }
            agent.stop();
            if (!agent.awaitTermination(SHUTDOWN_TIMEOUT)) {
                ConsoleOutput.error("Agent did not stop within " + SHUTDOWN_TIMEOUT.toSeconds() + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted");
        } finally {
            agent.close();
            subscription.unsubscribe();
        }

        var remaining = agent.getState().currentGoals();
        if (remaining.isEmpty()) {
            ConsoleOutput.success("All goals completed.");
        } else {
            ConsoleOutput.error(remaining.size() + " goal(s) not completed:");
            remaining.forEach(g -> ConsoleOutput.error("  " + g.description() + " (" + g.status() + ")"));
        }
        agent.lastError().ifPresent(e -> ConsoleOutput.error("Last error: " + e.getMessage()));
        ConsoleOutput.metrics(agent.getMetrics());
    }
}
