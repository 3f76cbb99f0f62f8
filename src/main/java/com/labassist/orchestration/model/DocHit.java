package com.labassist.orchestration.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DocHit(
        String filename,
        String title,
        String snippet,
        @JsonProperty("key_points") List<String> keyPoints
) {

    public DocHit {
        keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
    }
}
