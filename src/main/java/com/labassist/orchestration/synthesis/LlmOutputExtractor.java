package com.labassist.orchestration.synthesis;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Pulls the answer text out of a responses-API payload. Two shapes are accepted:
 * an {@code output} list whose first {@code message} item carries an
 * {@code output_text} content block, or a flat {@code output_text} string.
 */
final class LlmOutputExtractor {

    private LlmOutputExtractor() {
    }

    static String extract(JsonNode payload) {
        if (payload == null) {
            return "";
        }
        JsonNode output = payload.path("output");
        if (output.isArray()) {
            for (JsonNode item : output) {
                if (!"message".equals(item.path("type").asText())) {
                    continue;
                }
                for (JsonNode part : item.path("content")) {
                    if ("output_text".equals(part.path("type").asText())) {
                        return part.path("text").asText("");
                    }
                }
            }
        }
        JsonNode flat = payload.path("output_text");
        return flat.isTextual() ? flat.asText() : "";
    }
}
