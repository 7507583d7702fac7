package com.orbit.dispatch.cli;

import com.orbit.core.events.AgentEvent;
import com.orbit.core.model.PerformanceMetrics;
import com.orbit.core.model.PlanStep;
import com.orbit.core.model.PlanningResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Orbit CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ORBIT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ORBIT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void plan(PlanningResult result) {
        var plan = result.plan();
        System.out.println();
        System.out.println("PLAN " + plan.id());
        System.out.println("Goal: " + plan.goal().description() + " (" + plan.goal().type()
                + ", priority " + plan.goal().priority() + ")");
        System.out.println("Status: " + plan.status());
        System.out.println();
        System.out.println("STEPS:");
        int n = 1;
        for (PlanStep step : plan.steps()) {
            String after = step.hasPrerequisites() ? "  after " + String.join(", ", step.prerequisites()) : "";
            System.out.printf("  %d. %s [%s]%s%n", n++, step.action(), formatDuration(step.estimatedDuration()), after);
        }
        System.out.println();
        String feasibility = String.format("%.2f", result.feasibility());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Feasibility: " + (result.feasibility() >= 0.5 ? "@|fg(green) " : "@|fg(red) ") + feasibility + "|@"
                        + "  Estimated: " + formatDuration(result.estimatedDuration())));
        for (String risk : result.risks()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(yellow) !|@ " + risk));
        }
    }

    public static void event(AgentEvent event) {
        String prefix = switch (event.eventType()) {
            case "agent:started", "agent:stopped" -> "@|fg(cyan) [AGENT]|@";
            case "goal:completed" -> "@|fg(green),bold [GOAL]|@";
            case "error" -> "@|fg(red),bold [ERROR]|@";
            case "status:update" -> "@|fg(blue) [STATUS]|@";
            default -> null;
        };
        if (prefix == null) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + event.eventType() + " " + event.payload()));
    }

    public static void metrics(PerformanceMetrics m) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Agent Metrics|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Goals completed: @|fg(green) " + m.tasksCompleted() + "|@ in " + m.tasksAttempted() + " cycles"));
        System.out.println(String.format("  Average cycle: %.1fms", m.averageResponseTime()));
        System.out.println("  Uptime: " + formatDuration(m.uptime()));
        if (m.lastError() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(red) Last error at " + m.lastError() + "|@"));
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
