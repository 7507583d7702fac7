package com.orbit.core.decision;

import com.orbit.core.model.DecisionResult;
import com.orbit.core.model.ExecutionPlan;

/**
 * Selects an actionable option for a plan. The cycle loop branches only on
 * whether {@link DecisionResult#selection()} is present.
 */
@FunctionalInterface
public interface DecisionEngine {

    DecisionResult decide(ExecutionPlan plan);
}
