package com.labassist.orchestration;

import com.labassist.orchestration.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only, in-order record of the tool calls made while executing one plan.
 */
@Slf4j
final class ToolCallAudit {

    private static final int MAX_SNIPPET = 200;

    private final List<ToolCall> calls = new ArrayList<>();

    void record(ToolCall call) {
        calls.add(call);
        if (call.error() == null) {
            log.info("Tool call #{}: name={}, input={}", calls.size(), call.tool(), truncate(call.input()));
        } else {
            log.warn("Tool call #{} unavailable: name={}, input={}, error={}",
                    calls.size(), call.tool(), truncate(call.input()), call.error());
        }
    }

    int count() {
        return calls.size();
    }

    List<ToolCall> snapshot() {
        return List.copyOf(calls);
    }

    private static String truncate(@Nullable String value) {
        if (!StringUtils.hasText(value)) {
            return "";
        }
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_SNIPPET) {
            return normalized;
        }
        return normalized.substring(0, MAX_SNIPPET) + "...";
    }
}
