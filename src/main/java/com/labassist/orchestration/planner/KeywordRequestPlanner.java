package com.labassist.orchestration.planner;

import com.labassist.orchestration.model.AgentPlan;
import com.labassist.orchestration.model.PlanStep;
import com.labassist.orchestration.tools.ToolName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rule-based planner: always consults the documentation, adds an incident
 * lookup when the request describes an operational symptom, and ends with a
 * synthesis step.
 */
@Component
@Slf4j
public class KeywordRequestPlanner implements RequestPlanner {

    static final int MAX_TOOL_INPUT = 200;

    static final Set<String> INCIDENT_SIGNALS = Set.of(
            "error", "fail", "timeout", "crash", "outage", "incident", "down",
            "slow", "exception", "unavailable", "leak", "refused");

    static final String SEARCH_DOCS_ACTION = "Search documentation for relevant guidance";
    static final String QUERY_INCIDENTS_ACTION = "Look up similar past incidents";
    static final String SYNTHESIS_ACTION = "Synthesize findings into an answer";

    @Override
    public AgentPlan plan(String text) {
        String toolInput = toolInput(text);
        List<PlanStep> steps = new ArrayList<>();
        steps.add(PlanStep.toolStep(1, SEARCH_DOCS_ACTION, ToolName.SEARCH_DOCS, toolInput));

        StringBuilder reasoning = new StringBuilder("Searching documentation for guidance on the request.");
        String signal = findIncidentSignal(text);
        if (signal != null) {
            steps.add(PlanStep.toolStep(2, QUERY_INCIDENTS_ACTION, ToolName.QUERY_INCIDENTS, toolInput));
            reasoning.append(" The request mentions '").append(signal)
                    .append("', so past incidents are checked as well.");
        }
        steps.add(PlanStep.synthesisStep(steps.size() + 1, SYNTHESIS_ACTION));

        AgentPlan plan = new AgentPlan(reasoning.toString(), steps);
        log.debug("Planned {} steps: {}", steps.size(), plan.reasoning());
        return plan;
    }

    static String toolInput(String text) {
        String collapsed = text == null ? "" : text.trim().replaceAll("\\s+", " ");
        return collapsed.length() <= MAX_TOOL_INPUT ? collapsed : collapsed.substring(0, MAX_TOOL_INPUT);
    }

    private static String findIncidentSignal(String text) {
        if (text == null) {
            return null;
        }
        List<String> tokens = List.of(text.toLowerCase(Locale.ROOT).split("[^\\p{Alnum}]+"));
        return INCIDENT_SIGNALS.stream()
                .filter(signal -> tokens.stream().anyMatch(token -> token.startsWith(signal)))
                .sorted()
                .findFirst()
                .orElse(null);
    }
}
