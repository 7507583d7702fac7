package com.orbit.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * What an agent observed during the perceive phase of a cycle.
 *
 * @param observations opaque observations merged into the agent context
 * @param hints        free-form planning hints
 */
public record Perception(
    Map<String, Object> observations,
    List<String> hints
) implements Serializable {

    public Perception {
        observations = observations == null ? Map.of() : Map.copyOf(observations);
        hints = hints == null ? List.of() : List.copyOf(hints);
    }

    public static Perception empty() {
        return new Perception(Map.of(), List.of());
    }
}
