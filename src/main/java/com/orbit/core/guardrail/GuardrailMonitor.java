package com.orbit.core.guardrail;

import com.orbit.core.config.AgentProperties;
import com.orbit.core.model.Goal;
import com.orbit.core.model.GoalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Stateless pre-cycle check against the memory ceiling and the concurrency ceiling.
 * A failed check pauses the cycle loop; it never aborts it.
 */
public class GuardrailMonitor {

    private static final Logger log = LoggerFactory.getLogger(GuardrailMonitor.class);

    private final AgentProperties.Guardrails guardrails;
    private final HeapUsageProbe heapUsageProbe;

    public GuardrailMonitor(AgentProperties.Guardrails guardrails, HeapUsageProbe heapUsageProbe) {
        this.guardrails = guardrails;
        this.heapUsageProbe = heapUsageProbe;
    }

    /**
     * Evaluate both guards against the current goal list.
     *
     * @param goals the agent's current goals
     * @return the first violated guard, or {@link GuardrailCheck#ok()}
     */
    public GuardrailCheck check(List<Goal> goals) {
        double memUsage = heapUsageProbe.usedHeapMb();
        if (memUsage > guardrails.getMaxMemoryUsage()) {
            log.warn("Memory usage {} MB exceeds limit of {} MB", String.format("%.1f", memUsage),
                    guardrails.getMaxMemoryUsage());
            return GuardrailCheck.failed(GuardrailCheck.MEMORY,
                    String.format("heap %.1f MB > %.1f MB", memUsage, guardrails.getMaxMemoryUsage()));
        }

        long activeGoals = goals.stream().filter(g -> g.status() == GoalStatus.IN_PROGRESS).count();
        if (activeGoals > guardrails.getMaxConcurrentOperations()) {
            log.warn("Too many concurrent operations: {} active, limit {}",
                    activeGoals, guardrails.getMaxConcurrentOperations());
            return GuardrailCheck.failed(GuardrailCheck.CONCURRENCY,
                    activeGoals + " in-progress goals > " + guardrails.getMaxConcurrentOperations());
        }

        return GuardrailCheck.ok();
    }
}
