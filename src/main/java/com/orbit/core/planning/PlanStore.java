package com.orbit.core.planning;

import com.orbit.core.model.ExecutionPlan;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Insertion-ordered store of active plans. Plans are immutable and replaced wholesale.
 */
public class PlanStore {

    private final Map<String, ExecutionPlan> plans = new LinkedHashMap<>();

    public synchronized void put(ExecutionPlan plan) {
        plans.put(plan.id(), plan);
    }

    public synchronized Optional<ExecutionPlan> get(String planId) {
        return Optional.ofNullable(plans.get(planId));
    }

    /**
     * Atomically replace a stored plan.
     *
     * @return the replacement, or empty if no plan is stored under {@code planId}
     */
    public synchronized Optional<ExecutionPlan> update(String planId, UnaryOperator<ExecutionPlan> change) {
        ExecutionPlan current = plans.get(planId);
        if (current == null) {
            return Optional.empty();
        }
        ExecutionPlan next = change.apply(current);
        plans.put(planId, next);
        return Optional.of(next);
    }

    public synchronized List<ExecutionPlan> all() {
        return new ArrayList<>(plans.values());
    }

    public synchronized int removeIf(Predicate<ExecutionPlan> filter) {
        int removed = 0;
        Iterator<ExecutionPlan> it = plans.values().iterator();
        while (it.hasNext()) {
            if (filter.test(it.next())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized int size() {
        return plans.size();
    }
}
