package com.orbit.core.agent;

import com.orbit.core.config.AgentProperties;
import com.orbit.core.decision.DecisionEngine;
import com.orbit.core.decision.WeightedDecisionEngine;
import com.orbit.core.events.AgentEvent;
import com.orbit.core.events.AgentEvents;
import com.orbit.core.events.EventBus;
import com.orbit.core.guardrail.GuardrailCheck;
import com.orbit.core.guardrail.GuardrailMonitor;
import com.orbit.core.logging.MdcContext;
import com.orbit.core.memory.MemoryEntry;
import com.orbit.core.memory.MemoryStore;
import com.orbit.core.metrics.OrbitMetrics;
import com.orbit.core.model.AgentContext;
import com.orbit.core.model.AgentMessage;
import com.orbit.core.model.AgentState;
import com.orbit.core.model.AgentStatus;
import com.orbit.core.model.DecisionOption;
import com.orbit.core.model.DecisionResult;
import com.orbit.core.model.Goal;
import com.orbit.core.model.GoalStatus;
import com.orbit.core.model.Perception;
import com.orbit.core.model.PerformanceMetrics;
import com.orbit.core.model.PlanningContext;
import com.orbit.core.model.PlanningResult;
import com.orbit.core.model.ToolResult;
import com.orbit.core.planning.HierarchicalPlanningEngine;
import com.orbit.core.planning.PlanningEngine;
import com.orbit.core.time.Sleeper;
import com.orbit.core.tools.AgentTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Base class for agents driven by a perceive, plan, decide, act, learn cycle.
 * <p>
 * Each agent owns a single loop thread. {@link #start()} is single-flight: a second call
 * while the loop is running is ignored, and {@link #stop()} followed by {@code start()}
 * begins a fresh run. Every cycle is preceded by a guardrail check; a failed check pauses
 * the loop for {@link #GUARDRAIL_PAUSE_MS} without running the cycle. A cycle that throws
 * is recorded, the agent backs off for {@link #ERROR_BACKOFF_MS} and the loop continues.
 * <p>
 * Subclasses supply perception, execution and learning. Status, goals, context and
 * metrics may be read and modified from any thread.
 */
public abstract class AutonomousAgent implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AutonomousAgent.class);

    public static final long GUARDRAIL_PAUSE_MS = 5000;
    public static final long ERROR_BACKOFF_MS = 5000;

    static final double ERROR_MEMORY_IMPORTANCE = 0.8;
    static final double SENT_MESSAGE_IMPORTANCE = 0.5;
    static final double RECEIVED_MESSAGE_IMPORTANCE = 0.6;

    public static final String PERCEPTION_KEY = "perception";
    public static final String PENDING_MESSAGE_KEY = "pendingMessage";

    private final String id;
    protected final AgentProperties properties;
    protected final PlanningEngine planningEngine;
    protected final DecisionEngine decisionEngine;
    protected final MemoryStore memoryStore;
    protected final EventBus eventBus;
    protected final OrbitMetrics metrics;
    protected final Clock clock;
    private final Sleeper sleeper;
    private final GuardrailMonitor guardrailMonitor;
    private final Instant createdAt;

    private final ExecutorService loopExecutor;
    private final Map<String, AgentTool> tools = new LinkedHashMap<>();
    private final EventBus.Subscription goalCompletions;

    private final Object stateLock = new Object();
    private AgentStatus status = AgentStatus.IDLE;
    private final List<Goal> goals = new ArrayList<>();
    private AgentContext context;
    private Instant lastActivity;
    private int errorCount;
    private Throwable lastError;
    private int tasksCompleted;
    private int tasksAttempted;
    private int measuredCycles;
    private double averageResponseTime;
    private Instant lastErrorAt;

    private final Object lifecycleLock = new Object();
    private AtomicBoolean currentRun;
    private Future<?> loopFuture;
    private Instant runStartedAt;
    private volatile long cycleCount;

    protected AutonomousAgent(AgentProperties properties, AgentEnvironment environment) {
        this(properties, environment,
                new HierarchicalPlanningEngine(properties.getCapabilities().getPlanning(), environment.clock()),
                new WeightedDecisionEngine(properties.getCapabilities().getDecision(), environment.clock()));
    }

    protected AutonomousAgent(AgentProperties properties, AgentEnvironment environment,
                              PlanningEngine planningEngine, DecisionEngine decisionEngine) {
        if (properties.getName() == null || properties.getName().isBlank()) {
            throw new AgentConfigurationException("Agent name must not be blank");
        }
        if (properties.getCycleInterval() < 0) {
            throw new AgentConfigurationException("cycleInterval must be >= 0, got " + properties.getCycleInterval());
        }
        this.properties = properties;
        this.planningEngine = planningEngine;
        this.decisionEngine = decisionEngine;
        this.memoryStore = environment.memoryStore();
        this.eventBus = environment.eventBus();
        this.metrics = environment.metrics();
        this.clock = environment.clock();
        this.sleeper = environment.sleeper();
        this.guardrailMonitor = new GuardrailMonitor(properties.getGuardrails(), environment.heapUsageProbe());
        this.id = properties.getName().toLowerCase(Locale.ROOT) + "-" + UUID.randomUUID().toString().substring(0, 8);
        this.createdAt = clock.instant();
        this.lastActivity = createdAt;
        this.context = new AgentContext(null, Map.of(), List.of(), availableResources(), createdAt);

        this.loopExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "agent-" + properties.getName());
            t.setDaemon(true);
            return t;
        });

        this.goalCompletions = eventBus.subscribe(id, AgentEvents.GOAL_COMPLETED, event -> {
            synchronized (stateLock) {
                tasksCompleted++;
            }
            metrics.recordGoalCompleted(properties.getName());
            log.info("Goal completed: {}", event.payload().get("description"));
        });

        log.info("Agent {} created: specialty={}, cycleInterval={}ms",
                id, properties.getSpecialty(), properties.getCycleInterval());
    }

    // --- Lifecycle ---

    /**
     * Start the cycle loop on the agent's thread. Ignored when a run is already active.
     */
    public void start() {
        AtomicBoolean run = new AtomicBoolean(true);
        synchronized (lifecycleLock) {
            if (currentRun != null && currentRun.get()) {
                log.warn("Agent {} is already running", id);
                return;
            }
            currentRun = run;
            runStartedAt = clock.instant();
            loopFuture = loopExecutor.submit(() -> runLoop(run));
        }
        emit(AgentEvents.AGENT_STARTED, Map.of("name", properties.getName()));
        log.info("Agent {} started", id);
    }

    /**
     * Request the loop to exit after its current cycle. Idempotent.
     */
    public void stop() {
        AtomicBoolean run;
        synchronized (lifecycleLock) {
            run = currentRun;
        }
        if (run == null || !run.getAndSet(false)) {
            log.debug("Agent {} is not running", id);
            return;
        }
        emit(AgentEvents.AGENT_STOPPED, Map.of("name", properties.getName()));
        log.info("Agent {} stopping", id);
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return currentRun != null && currentRun.get();
        }
    }

    /**
     * Wait for the current run's loop to exit.
     *
     * @return true if the loop has exited (or was never started) within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Future<?> future;
        synchronized (lifecycleLock) {
            future = loopFuture;
        }
        if (future == null) {
            return true;
        }
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            log.error("Agent {} loop terminated abnormally", id, e.getCause());
            return true;
        }
    }

    /**
     * Stop the loop, release the loop thread and drop the agent's own event subscription.
     * The agent cannot be restarted afterwards.
     */
    @Override
    public void close() {
        stop();
        loopExecutor.shutdownNow();
        goalCompletions.unsubscribe();
    }

    private void runLoop(AtomicBoolean run) {
        MdcContext.setAgent(id);
        try {
            updateStatus(AgentStatus.IDLE);
            while (run.get()) {
                long cycleStart = clock.millis();
                MdcContext.setCycle(id, cycleCount);
                try {
                    GuardrailCheck check = guardrailMonitor.check(goalsSnapshot());
                    if (!check.passed()) {
                        log.warn("Guardrails check failed ({}), pausing", check.detail());
                        metrics.recordGuardrailPause(properties.getName(), check.reason());
                        sleeper.sleep(GUARDRAIL_PAUSE_MS);
                        checkTimeBudget();
                        continue;
                    }
                    runCycle(cycleStart);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Agent {} interrupted, leaving cycle loop", id);
                    stop();
                    break;
                } catch (Exception e) {
                    if (!handleError(e)) {
                        stop();
                        break;
                    }
                } catch (Error e) {
                    log.error("Fatal error in agent cycle, ending run: {}", e.toString(), e);
                    recordError(e);
                    stop();
                    break;
                }
                cycleCount++;
                checkTimeBudget();
            }
        } finally {
            if (run.get()) {
                stop();
            }
            updateStatus(AgentStatus.STOPPED);
            log.info("Agent {} stopped after {} cycles", id, cycleCount);
            MdcContext.clear();
        }
    }

    private void runCycle(long cycleStart) throws Exception {
        synchronized (stateLock) {
            tasksAttempted++;
        }
        updateStatus(AgentStatus.THINKING);

        Perception perception = perceive();
        updateContext(perception);

        Optional<PlanningResult> planning = plan(perception);
        if (planning.isPresent()) {
            DecisionResult decision = decide(planning.get());
            Optional<DecisionOption> selected = decision.selection();
            if (selected.isPresent()) {
                updateStatus(AgentStatus.ACTING);
                ToolResult result = execute(selected.get());
                learn(result);
            } else {
                log.debug("No option selected: {}", decision.reasoning());
            }
        }

        communicateStatus();
        updateMetrics(clock.millis() - cycleStart);
        updateStatus(AgentStatus.IDLE);

        sleeper.sleep(properties.getCycleInterval());
    }

    /**
     * @return false when the loop must exit because backoff was interrupted
     */
    private boolean handleError(Exception error) {
        log.error("Error in agent cycle: {}", error.getMessage(), error);
        recordError(error);

        try {
            sleeper.sleep(ERROR_BACKOFF_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Agent {} interrupted during error backoff", id);
            return false;
        }
        updateStatus(AgentStatus.IDLE);
        return true;
    }

    private void recordError(Throwable error) {
        synchronized (stateLock) {
            errorCount++;
            lastError = error;
            lastErrorAt = clock.instant();
        }
        metrics.recordCycleError(properties.getName());

        try {
            memoryStore.store(MemoryEntry.episodic(Map.of(
                    "error", String.valueOf(error.getMessage()),
                    "type", error.getClass().getName(),
                    "stack", stackTrace(error)), ERROR_MEMORY_IMPORTANCE));
        } catch (RuntimeException storeFailure) {
            log.warn("Failed to record cycle error in memory: {}", storeFailure.getMessage());
        }

        updateStatus(AgentStatus.ERROR);
        emit(AgentEvents.ERROR, Map.of(
                "error", String.valueOf(error.getMessage()),
                "type", error.getClass().getSimpleName()));
    }

    private void checkTimeBudget() {
        long budget = properties.getGuardrails().getMaxExecutionTime();
        if (budget <= 0) {
            return;
        }
        Instant started;
        synchronized (lifecycleLock) {
            started = runStartedAt;
        }
        if (Duration.between(started, clock.instant()).toMillis() > budget) {
            log.warn("Maximum execution time of {}ms exceeded", budget);
            stop();
        }
    }

    // --- Cycle phases ---

    /**
     * Observe the environment. Observations are merged into the agent context.
     */
    protected abstract Perception perceive() throws Exception;

    /**
     * Produce a plan for this cycle, or nothing when there is nothing to do.
     * The default plans for the highest-priority current goal.
     */
    protected Optional<PlanningResult> plan(Perception perception) {
        PlanningContext planningContext = planningContext();
        if (planningContext.currentGoals().isEmpty()) {
            log.debug("No goals, skipping planning");
            return Optional.empty();
        }
        return Optional.of(createPlan(planningContext, perception.hints()));
    }

    protected DecisionResult decide(PlanningResult planning) {
        return decisionEngine.decide(planning.plan());
    }

    protected abstract ToolResult execute(DecisionOption option) throws Exception;

    protected abstract void learn(ToolResult result) throws Exception;

    /**
     * Create a plan through the planning engine and record it.
     */
    protected PlanningResult createPlan(PlanningContext planningContext, List<String> hints) {
        PlanningResult result = planningEngine.createPlan(planningContext, hints);
        metrics.recordPlanCreated(properties.getName(), result.plan().goal().type().name(), result.feasibility());
        log.info("Plan {} created for goal '{}': {} steps, feasibility {}",
                result.plan().id(), result.plan().goal().description(), result.plan().steps().size(),
                String.format("%.2f", result.feasibility()));
        return result;
    }

    protected PlanningContext planningContext() {
        synchronized (stateLock) {
            return new PlanningContext(List.copyOf(goals), context.availableResources(),
                    properties.getPlanConstraints().toPlanConstraints());
        }
    }

    private void communicateStatus() {
        if (cycleCount % AgentEvents.STATUS_UPDATE_INTERVAL != 0) {
            return;
        }
        AgentState state = getState();
        emit(AgentEvents.STATUS_UPDATE, Map.of(
                "status", state.status().name(),
                "goals", state.currentGoals().size(),
                "errorCount", state.errorCount(),
                "cycle", cycleCount));
    }

    private void updateMetrics(long cycleTimeMs) {
        synchronized (stateLock) {
            // failed cycles count as attempts but carry no response time
            measuredCycles++;
            averageResponseTime = (averageResponseTime * (measuredCycles - 1) + cycleTimeMs) / measuredCycles;
            lastActivity = clock.instant();
        }
        metrics.recordCycle(properties.getName(), cycleTimeMs);
    }

    private void updateContext(Perception perception) {
        synchronized (stateLock) {
            Map<String, Object> environmentState = new HashMap<>(context.environmentState());
            environmentState.put(PERCEPTION_KEY, perception.observations());
            context = new AgentContext(context.currentTask(), environmentState, context.collaboratingAgents(),
                    availableResources(), clock.instant());
        }
    }

    /**
     * Replace the agent context atomically.
     */
    protected void updateAgentContext(UnaryOperator<AgentContext> updater) {
        synchronized (stateLock) {
            context = updater.apply(context);
        }
    }

    /**
     * Move to {@code next}, publishing {@code status:changed} when the status actually changes.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    protected void updateStatus(AgentStatus next) {
        AgentStatus previous;
        synchronized (stateLock) {
            previous = status;
            if (!previous.canTransitionTo(next)) {
                throw new IllegalStateException("Invalid status transition " + previous + " -> " + next);
            }
            status = next;
            lastActivity = clock.instant();
        }
        if (previous != next) {
            log.debug("Status {} -> {}", previous, next);
            emit(AgentEvents.STATUS_CHANGED, Map.of("from", previous.name(), "to", next.name()));
        }
    }

    // --- Goals ---

    public void addGoal(Goal goal) {
        synchronized (stateLock) {
            goals.add(goal);
        }
        log.info("Goal added: '{}' ({}, priority {})", goal.description(), goal.type(), goal.priority());
    }

    /**
     * @return false if no current goal has the given id
     */
    public boolean updateGoalStatus(String goalId, GoalStatus goalStatus) {
        synchronized (stateLock) {
            for (int i = 0; i < goals.size(); i++) {
                if (goals.get(i).id().equals(goalId)) {
                    goals.set(i, goals.get(i).withStatus(goalStatus));
                    return true;
                }
            }
        }
        log.warn("Goal {} not found", goalId);
        return false;
    }

    public boolean removeGoal(String goalId) {
        synchronized (stateLock) {
            return goals.removeIf(g -> g.id().equals(goalId));
        }
    }

    private List<Goal> goalsSnapshot() {
        synchronized (stateLock) {
            return List.copyOf(goals);
        }
    }

    // --- Tools and messaging ---

    /**
     * Make a tool available to plans. Its name is added to the available resources.
     *
     * @throws AgentConfigurationException if the tool is not in the allow-list
     */
    public void registerTool(AgentTool tool) {
        if (!properties.getGuardrails().isToolAllowed(tool.name())) {
            throw new AgentConfigurationException("Tool " + tool.name() + " is not allowed");
        }
        synchronized (stateLock) {
            tools.put(tool.name(), tool);
            context = new AgentContext(context.currentTask(), context.environmentState(),
                    context.collaboratingAgents(), availableResources(), context.timestamp());
        }
        log.info("Tool registered: {}", tool.name());
    }

    protected Map<String, AgentTool> tools() {
        synchronized (stateLock) {
            return Map.copyOf(tools);
        }
    }

    // caller holds stateLock or is the constructor
    private List<String> availableResources() {
        Set<String> resources = new LinkedHashSet<>(properties.getResources());
        resources.addAll(tools.keySet());
        return List.copyOf(resources);
    }

    /**
     * Send a request to another agent, or a notification to every agent when {@code to} is
     * {@link AgentMessage#BROADCAST}.
     *
     * @throws AgentConfigurationException if this agent may not initiate conversations, or may not broadcast
     */
    public AgentMessage sendMessage(String to, Object content) {
        var communication = properties.getCapabilities().getCommunication();
        if (!communication.isCanInitiateConversation()) {
            throw new AgentConfigurationException("Agent " + id + " cannot initiate conversations");
        }
        boolean broadcast = AgentMessage.BROADCAST.equals(to);
        if (broadcast && !communication.isCanBroadcast()) {
            throw new AgentConfigurationException("Agent " + id + " cannot broadcast");
        }
        var message = new AgentMessage(UUID.randomUUID().toString(), id, to,
                broadcast ? AgentMessage.Type.NOTIFICATION : AgentMessage.Type.REQUEST,
                content, clock.instant(), null);
        emit(AgentEvents.MESSAGE_SENT, Map.of("message", message));
        memoryStore.store(MemoryEntry.episodic(Map.of("action", "sent_message", "message", message),
                SENT_MESSAGE_IMPORTANCE));
        log.debug("Message {} sent to {}", message.id(), to);
        return message;
    }

    public void receiveMessage(AgentMessage message) {
        memoryStore.store(MemoryEntry.episodic(Map.of("action", "received_message", "message", message),
                RECEIVED_MESSAGE_IMPORTANCE));
        synchronized (stateLock) {
            Map<String, Object> environmentState = new HashMap<>(context.environmentState());
            environmentState.put(PENDING_MESSAGE_KEY, message);
            context = new AgentContext(context.currentTask(), environmentState, context.collaboratingAgents(),
                    context.availableResources(), clock.instant());
        }
        log.debug("Message {} received from {}", message.id(), message.from());
    }

    // --- Snapshots ---

    public AgentState getState() {
        synchronized (stateLock) {
            return new AgentState(id, properties.getName(), properties.getSpecialty(), status,
                    goals, context, lastActivity, errorCount);
        }
    }

    public PerformanceMetrics getMetrics() {
        synchronized (stateLock) {
            double successRate = tasksAttempted == 0 ? 0.0 : tasksCompleted / (double) tasksAttempted;
            return new PerformanceMetrics(tasksCompleted, tasksAttempted, successRate, averageResponseTime,
                    Duration.between(createdAt, clock.instant()).toMillis(), lastErrorAt);
        }
    }

    public Optional<Throwable> lastError() {
        synchronized (stateLock) {
            return Optional.ofNullable(lastError);
        }
    }

    public boolean checkGuardrails() {
        return guardrailMonitor.check(goalsSnapshot()).passed();
    }

    public long cycleCount() {
        return cycleCount;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return properties.getName();
    }

    protected void emit(String eventType, Map<String, Object> payload) {
        eventBus.publish(new AgentEvent(eventType, id, payload, clock.instant()));
    }

    private static String stackTrace(Throwable t) {
        var writer = new StringWriter();
        t.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
