package com.orbit.core.agent;

import com.orbit.core.config.AgentProperties;
import com.orbit.core.decision.DecisionEngine;
import com.orbit.core.events.AgentEvent;
import com.orbit.core.events.AgentEvents;
import com.orbit.core.events.EventBus;
import com.orbit.core.memory.InMemoryMemoryStore;
import com.orbit.core.memory.Memory;
import com.orbit.core.metrics.OrbitMetrics;
import com.orbit.core.model.AgentMessage;
import com.orbit.core.model.AgentStatus;
import com.orbit.core.model.DecisionOption;
import com.orbit.core.model.DecisionResult;
import com.orbit.core.model.ExecutionPlan;
import com.orbit.core.model.Goal;
import com.orbit.core.model.GoalStatus;
import com.orbit.core.model.Perception;
import com.orbit.core.model.PlanStatus;
import com.orbit.core.model.PlanningResult;
import com.orbit.core.model.ToolResult;
import com.orbit.core.planning.PlanningEngine;
import com.orbit.core.tools.AgentTool;
import com.orbit.support.VirtualClock;
import com.orbit.support.VirtualSleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutonomousAgentTest {

    private static final Duration AWAIT = Duration.ofSeconds(5);

    private VirtualClock clock;
    private VirtualSleeper sleeper;
    private EventBus eventBus;
    private InMemoryMemoryStore memory;
    private SimpleMeterRegistry registry;
    private AgentProperties properties;
    private volatile double heapMb;
    private List<AgentEvent> events;
    private ScriptedAgent agent;

    @BeforeEach
    void setUp() {
        clock = new VirtualClock();
        sleeper = new VirtualSleeper(clock);
        eventBus = new EventBus();
        memory = new InMemoryMemoryStore(100, clock);
        registry = new SimpleMeterRegistry();
        properties = new AgentProperties();
        properties.setCycleInterval(1000);
        heapMb = 10;
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
    }

    @AfterEach
    void tearDown() {
        if (agent != null) {
            agent.close();
        }
    }

    private AgentEnvironment environment() {
        return new AgentEnvironment(eventBus, memory, new OrbitMetrics(registry), clock, sleeper, () -> heapMb);
    }

    private ScriptedAgent newAgent() {
        agent = new ScriptedAgent(properties, environment());
        return agent;
    }

    private void stopAfterCycles(int cycles) {
        sleeper.afterSleep(ms -> {
            if (agent.cycleCount() >= cycles - 1) {
                agent.stop();
            }
        });
    }

    private long countEvents(String type) {
        return events.stream().filter(e -> e.eventType().equals(type)).count();
    }

    private List<String> transitions() {
        return events.stream()
                .filter(e -> e.eventType().equals(AgentEvents.STATUS_CHANGED))
                .map(e -> e.payload().get("from") + "->" + e.payload().get("to"))
                .toList();
    }

    // -- lifecycle -------------------------------------------------------------

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("starting twice runs exactly one loop")
        void doubleStartRunsOneLoop() throws Exception {
            var release = new CountDownLatch(1);
            Set<String> loopThreads = ConcurrentHashMap.newKeySet();
            newAgent().onPerceive(() -> {
                loopThreads.add(Thread.currentThread().getName() + "@" + Thread.currentThread().getId());
                release.await(5, TimeUnit.SECONDS);
                return Perception.empty();
            });
            stopAfterCycles(3);

            agent.start();
            agent.start();
            release.countDown();

            assertTrue(agent.awaitTermination(AWAIT));
            assertEquals(1, countEvents(AgentEvents.AGENT_STARTED));
            assertEquals(1, loopThreads.size());
            assertEquals(3, agent.perceiveCalls.get());
            assertEquals(AgentStatus.STOPPED, agent.getState().status());
        }

        @Test
        @DisplayName("stop is idempotent and a stopped agent can start again")
        void restartable() throws Exception {
            newAgent();
            stopAfterCycles(1);
            agent.start();
            assertTrue(agent.awaitTermination(AWAIT));
            agent.stop();
            assertEquals(1, countEvents(AgentEvents.AGENT_STOPPED));
            assertFalse(agent.isRunning());

            stopAfterCycles(2);
            agent.start();
            assertTrue(agent.awaitTermination(AWAIT));

            assertEquals(2, countEvents(AgentEvents.AGENT_STARTED));
            assertEquals(2, countEvents(AgentEvents.AGENT_STOPPED));
            assertEquals(AgentStatus.STOPPED, agent.getState().status());
            assertTrue(transitions().contains("STOPPED->IDLE"));
        }

        @Test
        @DisplayName("stop before start does nothing")
        void stopBeforeStart() {
            newAgent().stop();
            assertEquals(0, countEvents(AgentEvents.AGENT_STOPPED));
            assertEquals(AgentStatus.IDLE, agent.getState().status());
        }

        @Test
        @DisplayName("interrupting the loop thread ends the run")
        void interruptEndsLoop() throws Exception {
            var entered = new CountDownLatch(1);
            newAgent().onPerceive(() -> {
                entered.countDown();
                new CountDownLatch(1).await();
                return Perception.empty();
            });

            agent.start();
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            agent.close();

            assertTrue(agent.awaitTermination(AWAIT));
            assertEquals(AgentStatus.STOPPED, agent.getState().status());
            assertEquals(0, agent.getState().errorCount());
        }

        @Test
        @DisplayName("stops itself once the execution-time budget is exceeded")
        void executionTimeBudget() throws Exception {
            properties.getGuardrails().setMaxExecutionTime(2500);
            newAgent();

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            assertEquals(3, agent.cycleCount());
            assertEquals(1, countEvents(AgentEvents.AGENT_STOPPED));
            assertEquals(AgentStatus.STOPPED, agent.getState().status());
        }

        @Test
        @DisplayName("rejects a blank name")
        void blankName() {
            properties.setName(" ");
            assertThrows(AgentConfigurationException.class, AutonomousAgentTest.this::newAgent);
        }
    }

    // -- guardrails ------------------------------------------------------------

    @Nested
    @DisplayName("guardrails")
    class GuardrailTests {

        @Test
        @DisplayName("a failed guardrail pauses for 5000ms without perceiving")
        void pauseWithoutPerceiving() throws Exception {
            heapMb = 1024;
            newAgent();
            sleeper.afterSleep(ms -> {
                if (sleeper.sleeps().size() >= 3) {
                    agent.stop();
                }
            });

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            assertEquals(0, agent.perceiveCalls.get());
            assertEquals(List.of(5000L, 5000L, 5000L), sleeper.sleeps());
            assertEquals(3.0, registry.find("orbit.guardrail.pauses").tag("reason", "memory").counter().count());
            assertFalse(agent.checkGuardrails());
        }

        @Test
        @DisplayName("an in-progress goal over a zero concurrency limit pauses the loop")
        void concurrencyCeilingPauses() throws Exception {
            properties.getGuardrails().setMaxConcurrentOperations(0);
            var goal = Goal.immediate("ping", 5, clock.instant());
            newAgent().addGoal(goal);
            agent.updateGoalStatus(goal.id(), GoalStatus.IN_PROGRESS);
            sleeper.afterSleep(ms -> {
                if (sleeper.sleeps().size() >= 2) {
                    agent.stop();
                }
            });

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            assertEquals(List.of(5000L, 5000L), sleeper.sleeps());
            assertEquals(0, agent.perceiveCalls.get());
            assertEquals(0, agent.getState().errorCount());
            assertEquals(2.0, registry.find("orbit.guardrail.pauses").tag("reason", "concurrency").counter().count());
            assertNull(registry.find("orbit.guardrail.pauses").tag("reason", "memory").counter());
            assertEquals(AgentStatus.STOPPED, agent.getState().status());
        }

        @Test
        @DisplayName("the time budget still applies while paused")
        void budgetWhilePaused() throws Exception {
            heapMb = 1024;
            properties.getGuardrails().setMaxExecutionTime(12000);
            newAgent();

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            assertEquals(3, sleeper.count(AutonomousAgent.GUARDRAIL_PAUSE_MS));
        }

        @Test
        @DisplayName("resumes cycling once the guardrail clears")
        void resumes() throws Exception {
            heapMb = 1024;
            newAgent();
            sleeper.afterSleep(ms -> {
                if (ms == AutonomousAgent.GUARDRAIL_PAUSE_MS) {
                    heapMb = 10;
                } else {
                    agent.stop();
                }
            });

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            assertEquals(List.of(5000L, 1000L), sleeper.sleeps());
            assertEquals(1, agent.perceiveCalls.get());
        }
    }

    // -- errors ----------------------------------------------------------------

    @Nested
    @DisplayName("error handling")
    class ErrorTests {

        @Test
        @DisplayName("a cycle error is recorded, backs off 5000ms and the loop continues")
        void recoversFromCycleError() throws Exception {
            var calls = new AtomicInteger();
            newAgent().onPerceive(() -> {
                if (calls.getAndIncrement() == 0) {
                    throw new IllegalStateException("sensor offline");
                }
                return Perception.empty();
            });
            sleeper.afterSleep(ms -> {
                if (ms == properties.getCycleInterval()) {
                    agent.stop();
                }
            });

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            assertEquals(List.of(5000L, 1000L), sleeper.sleeps());
            assertEquals(1, agent.getState().errorCount());
            assertEquals("sensor offline", agent.lastError().orElseThrow().getMessage());
            assertNotNull(agent.getMetrics().lastError());
            assertEquals(1, countEvents(AgentEvents.ERROR));
            assertTrue(transitions().containsAll(List.of("THINKING->ERROR", "ERROR->IDLE")));

            Memory recorded = memory.recent(10).stream()
                    .filter(m -> "sensor offline".equals(m.content().get("error")))
                    .findFirst().orElseThrow();
            assertEquals(0.8, recorded.importance());
            assertTrue(recorded.content().get("stack").toString().contains("IllegalStateException"));
            assertEquals(1.0, registry.find("orbit.cycle.errors").counter().count());
        }

        @Test
        @DisplayName("errors keep being retried without a circuit breaker")
        void retriesIndefinitely() throws Exception {
            newAgent().onPerceive(() -> {
                throw new IllegalStateException("still broken");
            });
            sleeper.afterSleep(ms -> {
                if (agent.getState().errorCount() >= 4) {
                    agent.stop();
                }
            });

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            assertEquals(4, agent.getState().errorCount());
            assertEquals(4, sleeper.count(AutonomousAgent.ERROR_BACKOFF_MS));
            assertEquals(0.0, agent.getMetrics().successRate());
        }

        @Test
        @DisplayName("an Error is recorded, ends the run without backoff, and the agent can start again")
        void errorEndsRunAndAllowsRestart() throws Exception {
            var calls = new AtomicInteger();
            newAgent().onPerceive(() -> {
                if (calls.getAndIncrement() == 0) {
                    throw new AssertionError("broken invariant");
                }
                return Perception.empty();
            });

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            assertFalse(agent.isRunning());
            assertEquals(AgentStatus.STOPPED, agent.getState().status());
            assertEquals(1, agent.getState().errorCount());
            assertInstanceOf(AssertionError.class, agent.lastError().orElseThrow());
            assertEquals(1, countEvents(AgentEvents.ERROR));
            assertEquals(1, countEvents(AgentEvents.AGENT_STOPPED));
            assertTrue(sleeper.sleeps().isEmpty());
            assertTrue(memory.recent(10).stream()
                    .anyMatch(m -> "broken invariant".equals(m.content().get("error"))));

            stopAfterCycles(1);
            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            assertEquals(2, agent.perceiveCalls.get());
            assertEquals(2, countEvents(AgentEvents.AGENT_STARTED));
            assertEquals(List.of(1000L), sleeper.sleeps());
        }

        @Test
        @DisplayName("invalid status transitions are rejected")
        void invalidTransition() {
            newAgent();
            assertThrows(IllegalStateException.class, () -> agent.updateStatus(AgentStatus.ACTING));
        }
    }

    // -- cycle -----------------------------------------------------------------

    @Nested
    @DisplayName("cycle")
    class CycleTests {

        private PlanningEngine planningEngine;
        private DecisionEngine decisionEngine;
        private ExecutionPlan plan;
        private DecisionOption option;

        @BeforeEach
        void setUpEngines() {
            planningEngine = mock(PlanningEngine.class);
            decisionEngine = mock(DecisionEngine.class);
            Goal goal = Goal.immediate("ping", 5, clock.instant());
            plan = new ExecutionPlan("P-1", goal, List.of(), 5000, PlanStatus.DRAFT, Instant.EPOCH);
            option = new DecisionOption("P-1", "Execute plan", 0.7, 0.1, 0.9, 5000);
            when(planningEngine.createPlan(any(), anyList())).thenReturn(new PlanningResult(plan, 1.0, 5000, List.of()));
            when(decisionEngine.decide(plan)).thenReturn(
                    new DecisionResult("D-1", option, 0.8, "", List.of(), clock.instant()));
        }

        private ScriptedAgent agentWithEngines() {
            agent = new ScriptedAgent(properties, environment(), planningEngine, decisionEngine);
            return agent;
        }

        @Test
        @DisplayName("walks idle -> thinking -> acting -> idle and executes the selection")
        void fullCycle() throws Exception {
            agentWithEngines().addGoal(plan.goal());
            stopAfterCycles(1);

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            assertEquals(List.of("IDLE->THINKING", "THINKING->ACTING", "ACTING->IDLE", "IDLE->STOPPED"), transitions());
            assertEquals(List.of(option), agent.executed);
            assertEquals(1, agent.learned.size());
            assertEquals(1, agent.getMetrics().tasksAttempted());
            assertEquals(1.0, registry.find("orbit.plans.created").counter().count());
        }

        @Test
        @DisplayName("skips planning when there are no goals")
        void noGoalsNoPlanning() throws Exception {
            agentWithEngines();
            stopAfterCycles(2);

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            verify(planningEngine, never()).createPlan(any(), anyList());
            verify(decisionEngine, never()).decide(any());
            assertTrue(agent.executed.isEmpty());
        }

        @Test
        @DisplayName("does not act when nothing was selected")
        void noSelectionNoAction() throws Exception {
            when(decisionEngine.decide(plan)).thenReturn(DecisionResult.none("declined", clock.instant()));
            agentWithEngines().addGoal(plan.goal());
            stopAfterCycles(1);

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            assertTrue(agent.executed.isEmpty());
            assertFalse(transitions().contains("THINKING->ACTING"));
        }

        @Test
        @DisplayName("merges perception into the agent context")
        void mergesPerception() throws Exception {
            newAgent().onPerceive(() -> new Perception(Map.of("temperature", 21), List.of()));
            stopAfterCycles(1);

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            assertEquals(Map.of("temperature", 21),
                    agent.getState().currentContext().environmentState().get(AutonomousAgent.PERCEPTION_KEY));
        }

        @Test
        @DisplayName("emits status:update every tenth cycle")
        void periodicStatusUpdate() throws Exception {
            newAgent();
            stopAfterCycles(21);

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            assertEquals(21, agent.cycleCount());
            assertEquals(3, countEvents(AgentEvents.STATUS_UPDATE));
        }
    }

    // -- tools, messages and metrics ----------------------------------------------

    @Nested
    @DisplayName("tools and messaging")
    class ToolAndMessageTests {

        private AgentTool tool(String name) {
            AgentTool tool = mock(AgentTool.class);
            when(tool.name()).thenReturn(name);
            return tool;
        }

        @Test
        @DisplayName("registerTool rejects tools outside the allow-list")
        void disallowedTool() {
            newAgent();
            assertThrows(AgentConfigurationException.class, () -> agent.registerTool(tool("shell")));
        }

        @Test
        @DisplayName("registered tools become available resources")
        void allowedTool() {
            properties.setResources(List.of("disk"));
            properties.getGuardrails().setAllowedTools(List.of("log"));
            newAgent().registerTool(tool("log"));

            assertEquals(List.of("disk", "log"), agent.getState().currentContext().availableResources());
            assertEquals(Set.of("log"), agent.tools().keySet());
        }

        @Test
        @DisplayName("sendMessage fails when conversations are not allowed")
        void sendDisallowed() {
            properties.getCapabilities().getCommunication().setCanInitiateConversation(false);
            newAgent();
            assertThrows(AgentConfigurationException.class, () -> agent.sendMessage("peer", "hello"));
            assertEquals(0, memory.size());
        }

        @Test
        @DisplayName("sendMessage emits an event and is remembered")
        void send() {
            AgentMessage message = newAgent().sendMessage("peer", "hello");

            assertEquals(agent.getId(), message.from());
            assertEquals(1, countEvents(AgentEvents.MESSAGE_SENT));
            assertEquals(0.5, memory.recent(1).get(0).importance());
        }

        @Test
        @DisplayName("broadcast requires the broadcast capability")
        void broadcastDisallowed() {
            newAgent();
            assertThrows(AgentConfigurationException.class,
                    () -> agent.sendMessage(AgentMessage.BROADCAST, "hello all"));
            assertEquals(0, countEvents(AgentEvents.MESSAGE_SENT));
        }

        @Test
        @DisplayName("a permitted broadcast is sent as a notification")
        void broadcast() {
            properties.getCapabilities().getCommunication().setCanBroadcast(true);

            AgentMessage message = newAgent().sendMessage(AgentMessage.BROADCAST, "hello all");

            assertEquals(AgentMessage.Type.NOTIFICATION, message.type());
            assertEquals(AgentMessage.BROADCAST, message.to());
            assertEquals(1, countEvents(AgentEvents.MESSAGE_SENT));
        }

        @Test
        @DisplayName("receiveMessage stores the message as pending context")
        void receive() {
            var message = new AgentMessage("M-1", "peer", "me", AgentMessage.Type.NOTIFICATION, "hi",
                    clock.instant(), null);
            newAgent().receiveMessage(message);

            assertEquals(message,
                    agent.getState().currentContext().environmentState().get(AutonomousAgent.PENDING_MESSAGE_KEY));
            assertEquals(0.6, memory.recent(1).get(0).importance());
        }

        @Test
        @DisplayName("goal:completed events from this agent count as completed tasks")
        void completedTasks() throws Exception {
            newAgent();
            stopAfterCycles(4);
            agent.start();
            assertTrue(agent.awaitTermination(AWAIT));

            agent.emit(AgentEvents.GOAL_COMPLETED, Map.of("description", "ping"));
            eventBus.publish(new AgentEvent(AgentEvents.GOAL_COMPLETED, "someone-else", Map.of(), clock.instant()));

            var metrics = agent.getMetrics();
            assertEquals(1, metrics.tasksCompleted());
            assertEquals(4, metrics.tasksAttempted());
            assertEquals(0.25, metrics.successRate(), 1e-9);
            assertEquals(1.0, registry.find("orbit.goals.completed").counter().count());
        }

        @Test
        @DisplayName("average response time is the running mean of cycle times")
        void runningMeanResponseTime() throws Exception {
            long[] cycleTimes = {100, 300, 200};
            var calls = new AtomicInteger();
            newAgent().onPerceive(() -> {
                clock.advanceMillis(cycleTimes[calls.getAndIncrement()]);
                return Perception.empty();
            });
            stopAfterCycles(3);

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            assertEquals(3, agent.getMetrics().tasksAttempted());
            assertEquals(200.0, agent.getMetrics().averageResponseTime(), 1e-9);
        }

        @Test
        @DisplayName("failed cycles count as attempts but do not dilute the average")
        void failedCyclesExcludedFromAverage() throws Exception {
            var calls = new AtomicInteger();
            newAgent().onPerceive(() -> {
                if (calls.getAndIncrement() == 0) {
                    throw new IllegalStateException("sensor offline");
                }
                clock.advanceMillis(100);
                return Perception.empty();
            });
            sleeper.afterSleep(ms -> {
                if (ms == properties.getCycleInterval()) {
                    agent.stop();
                }
            });

            agent.start();

            assertTrue(agent.awaitTermination(AWAIT));
            var metrics = agent.getMetrics();
            assertEquals(2, metrics.tasksAttempted());
            assertEquals(100.0, metrics.averageResponseTime(), 1e-9);
            assertEquals(0.0, metrics.successRate());
        }

        @Test
        @DisplayName("closing the agent drops its event subscription")
        void closeUnsubscribes() {
            newAgent();
            assertEquals(1, eventBus.subscriberCount(agent.getId()));

            agent.close();

            assertEquals(0, eventBus.subscriberCount(agent.getId()));
        }

        @Test
        @DisplayName("goals can be added, updated and removed")
        void goals() {
            var goal = Goal.complex("build", 3, clock.instant());
            newAgent().addGoal(goal);

            assertTrue(agent.updateGoalStatus(goal.id(), GoalStatus.IN_PROGRESS));
            assertEquals(1, agent.getState().countGoals(GoalStatus.IN_PROGRESS));
            assertFalse(agent.updateGoalStatus("missing", GoalStatus.FAILED));
            assertTrue(agent.removeGoal(goal.id()));
            assertTrue(agent.getState().currentGoals().isEmpty());
        }
    }

    /**
     * Agent whose perception is scripted by the test; execute and learn are recorded.
     */
    static class ScriptedAgent extends AutonomousAgent {

        final AtomicInteger perceiveCalls = new AtomicInteger();
        final List<DecisionOption> executed = new CopyOnWriteArrayList<>();
        final List<ToolResult> learned = new CopyOnWriteArrayList<>();
        private volatile Callable<Perception> perception = Perception::empty;

        ScriptedAgent(AgentProperties properties, AgentEnvironment environment) {
            super(properties, environment);
        }

        ScriptedAgent(AgentProperties properties, AgentEnvironment environment,
                      PlanningEngine planningEngine, DecisionEngine decisionEngine) {
            super(properties, environment, planningEngine, decisionEngine);
        }

        ScriptedAgent onPerceive(Callable<Perception> perception) {
            this.perception = perception;
            return this;
        }

        @Override
        protected Perception perceive() throws Exception {
            perceiveCalls.incrementAndGet();
            return perception.call();
        }

        @Override
        protected ToolResult execute(DecisionOption option) {
            executed.add(option);
            return ToolResult.success(option.id(), 0, clock.instant());
        }

        @Override
        protected void learn(ToolResult result) {
            learned.add(result);
        }
    }
}
