package com.labassist.orchestration.tools;

/**
 * Raised by a retrieval tool when its backing infrastructure cannot answer.
 * "No matches" is never reported this way; that is an empty result.
 */
public class ToolUnavailableException extends RuntimeException {

    private final ToolName tool;

    public ToolUnavailableException(ToolName tool, String message, Throwable cause) {
        super(message, cause);
        this.tool = tool;
    }

    public ToolName getTool() {
        return tool;
    }
}
