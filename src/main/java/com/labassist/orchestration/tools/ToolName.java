package com.labassist.orchestration.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Retrieval capabilities a plan step may invoke.
 */
public enum ToolName {

    SEARCH_DOCS("search_docs"),
    QUERY_INCIDENTS("query_incidents");

    private final String wireName;

    ToolName(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ToolName fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (ToolName tool : values()) {
            if (tool.wireName.equals(value)) {
                return tool;
            }
        }
        throw new IllegalArgumentException("Unknown tool: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
