package com.labassist.orchestration.model;

import java.util.List;

public record ExecutionOutcome(
        AgentResult result,
        List<ToolCall> toolCalls
) {

    public ExecutionOutcome {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }
}
