package com.labassist.orchestration.lifecycle;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.labassist.entity.RequestStatus;

import java.util.UUID;

public record RequestAcknowledgement(
        @JsonProperty("request_id") UUID requestId,
        RequestStatus status
) {
}
