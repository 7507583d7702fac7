package com.orbit.core.planning;

import com.orbit.core.model.ExecutionPlan;
import com.orbit.core.model.PlanningContext;
import com.orbit.core.model.PlanningResult;
import com.orbit.core.model.StepStatus;

import java.util.List;
import java.util.Optional;

/**
 * Turns goals into validated, time-estimated execution plans and owns the active-plan store.
 * <p>
 * All operations throw {@link PlanningException} on invalid input; none of them catch
 * failures on behalf of the caller.
 */
public interface PlanningEngine {

    /**
     * Plan for the highest-priority goal in the context.
     *
     * @param context goals, available resources and caps
     * @param hints   free-form hints; those mentioning the goal's first word become steps
     */
    PlanningResult createPlan(PlanningContext context, List<String> hints);

    /**
     * Keep completed steps verbatim and regenerate the rest against a new context.
     */
    PlanningResult adaptPlan(String planId, PlanningContext newContext);

    /**
     * Set one step's status and recompute the plan's aggregate status.
     *
     * @return the updated plan
     */
    ExecutionPlan updatePlanProgress(String planId, String stepId, StepStatus status);

    /**
     * Re-score a stored plan against the given context without changing it.
     */
    PlanningResult assessPlan(String planId, PlanningContext context);

    Optional<ExecutionPlan> getPlan(String planId);

    /**
     * The first stored plan for {@code goalId} that is still in draft or executing.
     */
    Optional<ExecutionPlan> findActivePlan(String goalId);

    List<ExecutionPlan> getActivePlans();

    /**
     * Remove completed and failed plans.
     *
     * @return the number of plans removed
     */
    int cleanup();
}
