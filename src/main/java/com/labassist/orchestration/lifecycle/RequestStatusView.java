package com.labassist.orchestration.lifecycle;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.labassist.entity.RequestStatus;
import com.labassist.orchestration.model.AgentResult;

import java.util.UUID;

/**
 * Client-facing snapshot: {@code result} is set only when done, {@code error}
 * only when failed.
 */
public record RequestStatusView(
        @JsonProperty("request_id") UUID requestId,
        RequestStatus status,
        AgentResult result,
        String error
) {
}
