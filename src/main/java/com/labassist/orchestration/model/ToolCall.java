package com.labassist.orchestration.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Audit record of one tool invocation. {@code error} is set only when the tool
 * was unavailable and the step contributed an empty result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCall(
        String tool,
        String input,
        Object output,
        Instant timestamp,
        String error
) {

    public static ToolCall succeeded(String tool, String input, Object output, Instant timestamp) {
        return new ToolCall(tool, input, output, timestamp, null);
    }

    public static ToolCall unavailable(String tool, String input, Object emptyOutput, Instant timestamp, String error) {
        return new ToolCall(tool, input, emptyOutput, timestamp, error);
    }
}
