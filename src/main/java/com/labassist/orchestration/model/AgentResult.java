package com.labassist.orchestration.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Synthesized answer. Sources never hold duplicates; {@link #normalized}
 * additionally caps steps at {@value #MAX_STEPS} and guarantees at least one.
 */
public record AgentResult(
        String summary,
        List<String> steps,
        List<String> sources
) {

    public static final int MAX_STEPS = 5;
    public static final String REVIEW_SOURCES_STEP = "Review the sources listed below for more details.";

    public AgentResult {
        steps = steps == null ? List.of() : List.copyOf(steps);
        sources = sources == null ? List.of() : List.copyOf(new LinkedHashSet<>(sources));
    }

    public static AgentResult normalized(String summary, List<String> steps, List<String> sources) {
        List<String> capped = new ArrayList<>(steps == null ? List.of() : steps);
        if (capped.size() > MAX_STEPS) {
            capped = capped.subList(0, MAX_STEPS);
        }
        if (capped.isEmpty()) {
            capped = List.of(REVIEW_SOURCES_STEP);
        }
        return new AgentResult(summary, capped, sources);
    }
}
