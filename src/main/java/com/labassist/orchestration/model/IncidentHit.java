package com.labassist.orchestration.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IncidentHit(
        String id,
        String title,
        String description,
        String severity,
        String resolution
) {
}
