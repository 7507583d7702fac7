package com.orbit.core.planning;

import com.orbit.core.model.ExecutionPlan;
import com.orbit.core.model.Goal;
import com.orbit.core.model.PlanStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanStoreTest {

    private final PlanStore store = new PlanStore();

    private ExecutionPlan plan(String id, PlanStatus status) {
        return new ExecutionPlan(id, Goal.immediate("ping", 1, Instant.EPOCH), List.of(), 0, status, Instant.EPOCH);
    }

    @Test
    @DisplayName("keeps insertion order and replaces plans wholesale")
    void insertionOrder() {
        store.put(plan("a", PlanStatus.DRAFT));
        store.put(plan("b", PlanStatus.DRAFT));
        store.update("a", p -> p.withStatus(PlanStatus.EXECUTING));

        assertEquals(List.of("a", "b"), store.all().stream().map(ExecutionPlan::id).toList());
        assertEquals(PlanStatus.EXECUTING, store.get("a").orElseThrow().status());
    }

    @Test
    @DisplayName("update of a missing plan is empty")
    void updateMissing() {
        assertTrue(store.update("missing", p -> p).isEmpty());
    }

    @Test
    @DisplayName("removeIf reports the number removed")
    void removeIf() {
        store.put(plan("a", PlanStatus.COMPLETED));
        store.put(plan("b", PlanStatus.DRAFT));
        store.put(plan("c", PlanStatus.FAILED));

        assertEquals(2, store.removeIf(p -> p.status().isTerminal()));
        assertEquals(1, store.size());
    }
}
