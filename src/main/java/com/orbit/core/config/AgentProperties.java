package com.orbit.core.config;

import com.orbit.core.model.PlanConstraints;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Static agent configuration: identity, pacing, guardrails and capabilities.
 * Read-only once an agent has been constructed from it.
 */
@Component
@ConfigurationProperties(prefix = "orbit.agent")
public class AgentProperties {

    private String name = "orbit";
    private String specialty = "general";
    /** Rate-limit sleep between cycles, in milliseconds. */
    private long cycleInterval = 1000;
    private int memoryCapacity = 1000;
    private List<String> resources = new ArrayList<>();
    private Constraints planConstraints = new Constraints();
    private Guardrails guardrails = new Guardrails();
    private Capabilities capabilities = new Capabilities();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSpecialty() {
        return specialty;
    }

    public void setSpecialty(String specialty) {
        this.specialty = specialty;
    }

    public long getCycleInterval() {
        return cycleInterval;
    }

    public void setCycleInterval(long cycleInterval) {
        this.cycleInterval = cycleInterval;
    }

    public int getMemoryCapacity() {
        return memoryCapacity;
    }

    public void setMemoryCapacity(int memoryCapacity) {
        this.memoryCapacity = memoryCapacity;
    }

    public List<String> getResources() {
        return resources;
    }

    public void setResources(List<String> resources) {
        this.resources = resources;
    }

    public Constraints getPlanConstraints() {
        return planConstraints;
    }

    public void setPlanConstraints(Constraints planConstraints) {
        this.planConstraints = planConstraints;
    }

    public Guardrails getGuardrails() {
        return guardrails;
    }

    public void setGuardrails(Guardrails guardrails) {
        this.guardrails = guardrails;
    }

    public Capabilities getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(Capabilities capabilities) {
        this.capabilities = capabilities;
    }

    public static class Constraints {
        private Integer maxSteps;
        private Long maxDuration;

        public Integer getMaxSteps() {
            return maxSteps;
        }

        public void setMaxSteps(Integer maxSteps) {
            this.maxSteps = maxSteps;
        }

        public Long getMaxDuration() {
            return maxDuration;
        }

        public void setMaxDuration(Long maxDuration) {
            this.maxDuration = maxDuration;
        }

        public PlanConstraints toPlanConstraints() {
            return new PlanConstraints(maxSteps, maxDuration);
        }
    }

    public static class Guardrails {
        /** Total run budget in milliseconds; 0 disables the limit. */
        private long maxExecutionTime = 0;
        /** Heap ceiling in MB. */
        private double maxMemoryUsage = 512;
        private int maxConcurrentOperations = 1;
        private List<String> allowedTools = new ArrayList<>();

        public long getMaxExecutionTime() {
            return maxExecutionTime;
        }

        public void setMaxExecutionTime(long maxExecutionTime) {
            this.maxExecutionTime = maxExecutionTime;
        }

        public double getMaxMemoryUsage() {
            return maxMemoryUsage;
        }

        public void setMaxMemoryUsage(double maxMemoryUsage) {
            this.maxMemoryUsage = maxMemoryUsage;
        }

        public int getMaxConcurrentOperations() {
            return maxConcurrentOperations;
        }

        public void setMaxConcurrentOperations(int maxConcurrentOperations) {
            this.maxConcurrentOperations = maxConcurrentOperations;
        }

        public List<String> getAllowedTools() {
            return allowedTools;
        }

        public void setAllowedTools(List<String> allowedTools) {
            this.allowedTools = allowedTools;
        }

        public boolean isToolAllowed(String toolName) {
            return allowedTools != null && allowedTools.contains(toolName);
        }
    }

    public static class Capabilities {
        private Planning planning = new Planning();
        private Decision decision = new Decision();
        private Communication communication = new Communication();

        public Planning getPlanning() {
            return planning;
        }

        public void setPlanning(Planning planning) {
            this.planning = planning;
        }

        public Decision getDecision() {
            return decision;
        }

        public void setDecision(Decision decision) {
            this.decision = decision;
        }

        public Communication getCommunication() {
            return communication;
        }

        public void setCommunication(Communication communication) {
            this.communication = communication;
        }
    }

    public static class Planning {
        private boolean canCreatePlans = true;
        private boolean canAdaptPlans = false;
        private boolean canPrioritizeTasks = false;
        private int maxPlanningHorizon = 5;
        private List<PlanType> supportedPlanTypes = new ArrayList<>(List.of(PlanType.SEQUENTIAL));

        public boolean isCanCreatePlans() {
            return canCreatePlans;
        }

        public void setCanCreatePlans(boolean canCreatePlans) {
            this.canCreatePlans = canCreatePlans;
        }

        public boolean isCanAdaptPlans() {
            return canAdaptPlans;
        }

        public void setCanAdaptPlans(boolean canAdaptPlans) {
            this.canAdaptPlans = canAdaptPlans;
        }

        public boolean isCanPrioritizeTasks() {
            return canPrioritizeTasks;
        }

        public void setCanPrioritizeTasks(boolean canPrioritizeTasks) {
            this.canPrioritizeTasks = canPrioritizeTasks;
        }

        public int getMaxPlanningHorizon() {
            return maxPlanningHorizon;
        }

        public void setMaxPlanningHorizon(int maxPlanningHorizon) {
            this.maxPlanningHorizon = maxPlanningHorizon;
        }

        public List<PlanType> getSupportedPlanTypes() {
            return supportedPlanTypes;
        }

        public void setSupportedPlanTypes(List<PlanType> supportedPlanTypes) {
            this.supportedPlanTypes = supportedPlanTypes;
        }

        public boolean supportsParallel() {
            return supportedPlanTypes != null && supportedPlanTypes.contains(PlanType.PARALLEL);
        }

        public boolean isSequentialOnly() {
            return supportedPlanTypes != null
                    && supportedPlanTypes.contains(PlanType.SEQUENTIAL)
                    && !supportsParallel();
        }
    }

    public static class Decision {
        private boolean canMakeAutonomousDecisions = true;
        private boolean requiresApproval = false;
        private int maxDecisionComplexity = 5;
        private boolean canEvaluateRisk = true;

        public boolean isCanMakeAutonomousDecisions() {
            return canMakeAutonomousDecisions;
        }

        public void setCanMakeAutonomousDecisions(boolean canMakeAutonomousDecisions) {
            this.canMakeAutonomousDecisions = canMakeAutonomousDecisions;
        }

        public boolean isRequiresApproval() {
            return requiresApproval;
        }

        public void setRequiresApproval(boolean requiresApproval) {
            this.requiresApproval = requiresApproval;
        }

        public int getMaxDecisionComplexity() {
            return maxDecisionComplexity;
        }

        public void setMaxDecisionComplexity(int maxDecisionComplexity) {
            this.maxDecisionComplexity = maxDecisionComplexity;
        }

        public boolean isCanEvaluateRisk() {
            return canEvaluateRisk;
        }

        public void setCanEvaluateRisk(boolean canEvaluateRisk) {
            this.canEvaluateRisk = canEvaluateRisk;
        }
    }

    public static class Communication {
        private boolean canInitiateConversation = true;
        private boolean canBroadcast = false;

        public boolean isCanInitiateConversation() {
            return canInitiateConversation;
        }

        public void setCanInitiateConversation(boolean canInitiateConversation) {
            this.canInitiateConversation = canInitiateConversation;
        }

        public boolean isCanBroadcast() {
            return canBroadcast;
        }

        public void setCanBroadcast(boolean canBroadcast) {
            this.canBroadcast = canBroadcast;
        }
    }

    public enum PlanType {
        SEQUENTIAL,
        PARALLEL,
        HIERARCHICAL
    }
}
