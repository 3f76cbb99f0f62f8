package com.labassist.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.labassist.orchestration.tools.ToolName;
import org.springframework.util.StringUtils;

/**
 * One planned action. A step without a tool marks the synthesis stage and
 * invokes nothing.
 */
public record PlanStep(
        @JsonProperty("step_number") int stepNumber,
        String action,
        ToolName tool,
        @JsonProperty("tool_input") String toolInput
) {

    public static PlanStep toolStep(int stepNumber, String action, ToolName tool, String toolInput) {
        return new PlanStep(stepNumber, action, tool, toolInput);
    }

    public static PlanStep synthesisStep(int stepNumber, String action) {
        return new PlanStep(stepNumber, action, null, null);
    }

    @JsonIgnore
    public boolean isInvocable() {
        return tool != null && StringUtils.hasLength(toolInput);
    }
}
