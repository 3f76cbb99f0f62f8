package com.labassist.orchestration;

import com.labassist.orchestration.model.AgentPlan;
import com.labassist.orchestration.model.AgentResult;
import com.labassist.orchestration.model.DocHit;
import com.labassist.orchestration.model.ExecutionOutcome;
import com.labassist.orchestration.model.IncidentHit;
import com.labassist.orchestration.model.PlanStep;
import com.labassist.orchestration.model.ToolCall;
import com.labassist.orchestration.synthesis.SynthesisEngine;
import com.labassist.orchestration.tools.DocumentSearchTool;
import com.labassist.orchestration.tools.IncidentQueryTool;
import com.labassist.orchestration.tools.ToolName;
import com.labassist.orchestration.tools.ToolUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Walks a plan in its declared order, invokes the retrieval tool of every step
 * that names one and has input, then synthesizes exactly once.
 * <p>
 * A tool that reports {@link ToolUnavailableException} contributes an empty
 * result for its step; the remaining steps still run.
 */
@Service
@Slf4j
public class PlanExecutor {

    private final DocumentSearchTool documentSearchTool;
    private final IncidentQueryTool incidentQueryTool;
    private final SynthesisEngine synthesisEngine;
    private final Clock clock;

    public PlanExecutor(DocumentSearchTool documentSearchTool,
                        IncidentQueryTool incidentQueryTool,
                        SynthesisEngine synthesisEngine,
                        Clock clock) {
        this.documentSearchTool = documentSearchTool;
        this.incidentQueryTool = incidentQueryTool;
        this.synthesisEngine = synthesisEngine;
        this.clock = clock;
    }

    public ExecutionOutcome execute(String text, AgentPlan plan) {
        List<DocHit> docResults = new ArrayList<>();
        List<IncidentHit> incidentResults = new ArrayList<>();
        ToolCallAudit audit = new ToolCallAudit();

        for (PlanStep step : plan.steps()) {
            if (step.tool() == null) {
                log.debug("Step {}: synthesis marker, no tool call", step.stepNumber());
                continue;
            }
            if (!step.isInvocable()) {
                log.debug("Step {}: {} has no input, skipped", step.stepNumber(), step.tool());
                continue;
            }
            String input = step.toolInput();
            switch (step.tool()) {
                case SEARCH_DOCS -> docResults.addAll(
                        invoke(ToolName.SEARCH_DOCS, input, () -> documentSearchTool.search(input), audit));
                case QUERY_INCIDENTS -> incidentResults.addAll(
                        invoke(ToolName.QUERY_INCIDENTS, input, () -> incidentQueryTool.query(input), audit));
            }
        }

        log.info("Plan executed: {} tool calls, {} doc hits, {} incident hits",
                audit.count(), docResults.size(), incidentResults.size());
        AgentResult result = synthesisEngine.synthesize(text, docResults, incidentResults);
        return new ExecutionOutcome(result, audit.snapshot());
    }

    private <T> List<T> invoke(ToolName tool, String input, Supplier<List<T>> call, ToolCallAudit audit) {
        try {
            List<T> hits = call.get();
            audit.record(ToolCall.succeeded(tool.wireName(), input, hits, clock.instant()));
            return hits;
        } catch (ToolUnavailableException ex) {
            audit.record(ToolCall.unavailable(tool.wireName(), input, List.of(), clock.instant(), ex.getMessage()));
            return List.of();
        }
    }
}
