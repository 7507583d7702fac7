package com.orbit.core.planning;

import com.orbit.core.model.PlanStep;
import com.orbit.core.model.StepStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResourceExtractorTest {

    private PlanStep step(String action, List<String> resources) {
        return new PlanStep("s1", action, action, List.of(), 1000, StepStatus.PENDING, resources);
    }

    @Test
    @DisplayName("extracts the word after each 'use', lower-cased and de-duplicated")
    void extractsUsePhrases() {
        assertEquals(List.of("docker", "maven"),
                ResourceExtractor.extract("Use Docker, then use maven and USE docker again"));
    }

    @Test
    @DisplayName("ignores 'use' inside other words")
    void wordBoundary() {
        assertEquals(List.of(), ResourceExtractor.extract("reuse cache because abuse"));
        assertEquals(List.of(), ResourceExtractor.extract(null));
    }

    @Test
    @DisplayName("structured resources take precedence over the action text")
    void structuredFieldWins() {
        assertEquals(List.of("git"), ResourceExtractor.requiredResources(step("use docker", List.of("Git"))));
        assertEquals(List.of("docker"), ResourceExtractor.requiredResources(step("use docker", List.of())));
    }
}
