package com.labassist.orchestration.synthesis;

import com.fasterxml.jackson.databind.JsonNode;
import com.labassist.orchestration.model.AgentResult;
import com.labassist.orchestration.model.DocHit;
import com.labassist.orchestration.model.IncidentHit;
import com.labassist.orchestration.service.JsonProcessingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Synthesis through a remote text-generation endpoint. Any failure, including a
 * missing credential, falls back to {@link DeterministicSynthesizer} with the
 * same inputs.
 */
@Component
@Slf4j
public class LlmSynthesizer implements ResultSynthesizer {

    static final String RESPONSES_PATH = "/responses";

    static final String PROMPT_TEMPLATE = """
            User question: %s

            Documentation results:
            %s

            Incident results:
            %s

            Based on this information, provide:
            1. A clear summary answering the user's question
            2. Actionable steps they can take
            3. List the sources (filenames and incident IDs) you used

            Respond with JSON:
            {
              "summary": "...",
              "steps": ["step1", "step2", ...],
              "sources": ["filename.md", "INC-XXX", ...]
            }""";

    private final SynthesisSettings settings;
    private final RestClient restClient;
    private final DeterministicSynthesizer deterministic;
    private final JsonProcessingService jsonProcessingService;

    public LlmSynthesizer(SynthesisSettings settings,
                          @Qualifier("llmRestClient") RestClient restClient,
                          DeterministicSynthesizer deterministic,
                          JsonProcessingService jsonProcessingService) {
        this.settings = settings;
        this.restClient = restClient;
        this.deterministic = deterministic;
        this.jsonProcessingService = jsonProcessingService;
    }

    @Override
    public AgentResult synthesize(String text, List<DocHit> docResults, List<IncidentHit> incidentResults) {
        SynthesisAttempt attempt = attempt(text, docResults, incidentResults);
        if (attempt.isSuccess()) {
            return attempt.result();
        }
        if (attempt.failure() == SynthesisFailure.MISSING_CREDENTIAL) {
            log.warn("LLM API key not set, falling back to deterministic synthesis");
        } else {
            log.error("LLM synthesis failed ({}: {}), falling back to deterministic",
                    attempt.failure(), attempt.detail());
        }
        return deterministic.synthesize(text, docResults, incidentResults);
    }

    SynthesisAttempt attempt(String text, List<DocHit> docResults, List<IncidentHit> incidentResults) {
        if (!settings.hasCredential()) {
            return SynthesisAttempt.failed(SynthesisFailure.MISSING_CREDENTIAL, "no API key configured");
        }

        String body;
        try {
            body = restClient.post()
                    .uri(RESPONSES_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.apiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(requestBody(buildPrompt(text, docResults, incidentResults)))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException ex) {
            return SynthesisAttempt.failed(SynthesisFailure.HTTP_STATUS, ex.getStatusCode().toString());
        } catch (RestClientException ex) {
            return SynthesisAttempt.failed(SynthesisFailure.TRANSPORT, ex.getMessage());
        }

        Optional<JsonNode> payload = jsonProcessingService.readTree("LLM response", body);
        if (payload.isEmpty()) {
            return SynthesisAttempt.failed(SynthesisFailure.MALFORMED_RESPONSE, "response body is not JSON");
        }

        String content = LlmOutputExtractor.extract(payload.get());
        if (!StringUtils.hasText(content)) {
            return SynthesisAttempt.failed(SynthesisFailure.EMPTY_TEXT, "empty response content");
        }

        Optional<JsonNode> answer = jsonProcessingService.readTree("LLM answer", content);
        if (answer.isEmpty()) {
            return SynthesisAttempt.failed(SynthesisFailure.MALFORMED_JSON, "answer text is not JSON");
        }
        return toResult(answer.get());
    }

    String buildPrompt(String text, List<DocHit> docResults, List<IncidentHit> incidentResults) {
        return PROMPT_TEMPLATE.formatted(
                text,
                jsonProcessingService.toPrettyJson(docResults == null ? List.of() : docResults),
                jsonProcessingService.toPrettyJson(incidentResults == null ? List.of() : incidentResults));
    }

    private Map<String, Object> requestBody(String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", settings.model());
        body.put("input", prompt);
        body.put("temperature", settings.temperature());
        body.put("text", Map.of("format", Map.of("type", "json_object")));
        return body;
    }

    static SynthesisAttempt toResult(JsonNode node) {
        if (!node.isObject()) {
            return SynthesisAttempt.failed(SynthesisFailure.SCHEMA_MISMATCH, "answer is not a JSON object");
        }
        JsonNode summary = node.get("summary");
        if (summary == null || !summary.isTextual()) {
            return SynthesisAttempt.failed(SynthesisFailure.SCHEMA_MISMATCH, "summary must be a string");
        }
        List<String> steps = new ArrayList<>();
        if (!readStrings(node, "steps", steps)) {
            return SynthesisAttempt.failed(SynthesisFailure.SCHEMA_MISMATCH, "steps must be a list of strings");
        }
        List<String> sources = new ArrayList<>();
        if (!readStrings(node, "sources", sources)) {
            return SynthesisAttempt.failed(SynthesisFailure.SCHEMA_MISMATCH, "sources must be a list of strings");
        }
        return SynthesisAttempt.succeeded(AgentResult.normalized(summary.asText(), steps, sources));
    }

    private static boolean readStrings(JsonNode node, String field, List<String> target) {
        if (!node.has(field)) {
            return true;
        }
        JsonNode array = node.get(field);
        if (!array.isArray()) {
            return false;
        }
        for (JsonNode element : array) {
            if (!element.isTextual()) {
                return false;
            }
            target.add(element.asText());
        }
        return true;
    }
}
