package com.orbit.core.planning;

import com.orbit.core.model.PlanStep;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the resources a step needs.
 * <p>
 * A step's structured {@code requiredResources} list wins; steps without one fall back to
 * scanning the action text for "use &lt;word&gt;" phrases. Names are lower-cased.
 */
public final class ResourceExtractor {

    private static final Pattern USE_PATTERN = Pattern.compile("\\buse\\s+(\\w+)", Pattern.CASE_INSENSITIVE);

    private ResourceExtractor() {}

    public static List<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> found = new LinkedHashSet<>();
        Matcher m = USE_PATTERN.matcher(text);
        while (m.find()) {
            found.add(m.group(1).toLowerCase(Locale.ROOT));
        }
        return new ArrayList<>(found);
    }

    public static List<String> requiredResources(PlanStep step) {
        if (!step.requiredResources().isEmpty()) {
            return step.requiredResources().stream()
                    .map(r -> r.toLowerCase(Locale.ROOT))
                    .toList();
        }
        return extract(step.action());
    }
}
