package com.labassist.orchestration.synthesis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.labassist.orchestration.model.AgentResult;
import com.labassist.orchestration.model.DocHit;
import com.labassist.orchestration.model.IncidentHit;
import com.labassist.orchestration.service.JsonProcessingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LlmSynthesizerTest {

    private static final String BASE_URL = "https://llm.example.com/v1";

    private final DeterministicSynthesizer deterministic = new DeterministicSynthesizer();
    private final JsonProcessingService jsonProcessingService =
            new JsonProcessingService(new ObjectMapper().findAndRegisterModules());

    private final List<DocHit> docs = List.of(
            new DocHit("db.md", "DB Timeouts", "Check pool settings", List.of("Check pool size", "Increase timeout")));
    private final List<IncidentHit> incidents = List.of(
            new IncidentHit("INC-001", "Pool exhausted", null, "high", "Raised pool size"));

    private MockRestServiceServer server;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    private LlmSynthesizer synthesizer(String apiKey) {
        return new LlmSynthesizer(new SynthesisSettings(true, apiKey, "gpt-4", 0.3),
                restClient, deterministic, jsonProcessingService);
    }

    private void respondWith(String body) {
        server.expect(requestTo(BASE_URL + "/responses"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
    }

    @Test
    void testMessageShapedResponse() {
        server.expect(requestTo(BASE_URL + "/responses"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer test-key"))
                .andExpect(jsonPath("$.model").value("gpt-4"))
                .andExpect(jsonPath("$.text.format.type").value("json_object"))
                .andRespond(withSuccess("""
                        {
                          "output": [
                            {"type": "reasoning", "content": []},
                            {"type": "message", "content": [
                              {"type": "output_text",
                               "text": "{\\"summary\\": \\"Raise the pool size.\\", \\"steps\\": [\\"Check pool size\\"], \\"sources\\": [\\"db.md\\", \\"INC-001\\"]}"}
                            ]}
                          ]
                        }
                        """, MediaType.APPLICATION_JSON));

        AgentResult result = synthesizer("test-key").synthesize("timeout", docs, incidents);

        server.verify();
        assertEquals("Raise the pool size.", result.summary());
        assertEquals(List.of("Check pool size"), result.steps());
        assertEquals(List.of("db.md", "INC-001"), result.sources());
    }

    @Test
    void testFlatOutputTextResponse() {
        respondWith("""
                {"output_text": "{\\"summary\\": \\"Flat answer\\", \\"steps\\": [\\"Do it\\"], \\"sources\\": []}"}
                """);

        AgentResult result = synthesizer("test-key").synthesize("timeout", docs, incidents);

        assertEquals("Flat answer", result.summary());
        assertEquals(List.of("Do it"), result.steps());
        assertTrue(result.sources().isEmpty());
    }

    @Test
    void testAnswerIsNormalized() {
        respondWith("""
                {"output_text": "{\\"summary\\": \\"S\\", \\"steps\\": [\\"1\\",\\"2\\",\\"3\\",\\"4\\",\\"5\\",\\"6\\"], \\"sources\\": [\\"INC-1\\", \\"INC-1\\"]}"}
                """);

        AgentResult result = synthesizer("test-key").synthesize("timeout", docs, incidents);

        assertEquals(List.of("1", "2", "3", "4", "5"), result.steps());
        assertEquals(List.of("INC-1"), result.sources());
    }

    @Test
    void testMissingStepsGetReviewSourcesStep() {
        respondWith("""
                {"output_text": "{\\"summary\\": \\"Only a summary\\"}"}
                """);

        AgentResult result = synthesizer("test-key").synthesize("timeout", docs, incidents);

        assertEquals("Only a summary", result.summary());
        assertEquals(List.of(AgentResult.REVIEW_SOURCES_STEP), result.steps());
    }

    @Test
    void testNoCredentialMatchesDeterministic() {
        LlmSynthesizer llm = synthesizer(null);

        AgentResult result = llm.synthesize("timeout", docs, incidents);

        server.verify();
        assertEquals(deterministic.synthesize("timeout", docs, incidents), result);
        assertEquals(SynthesisFailure.MISSING_CREDENTIAL, llm.attempt("timeout", docs, incidents).failure());
    }

    @Test
    void testServerErrorFallsBack() {
        server.expect(requestTo(BASE_URL + "/responses")).andRespond(withServerError());

        AgentResult result = synthesizer("test-key").synthesize("timeout", docs, incidents);

        assertEquals(deterministic.synthesize("timeout", docs, incidents), result);
    }

    @Test
    void testServerErrorReason() {
        server.expect(requestTo(BASE_URL + "/responses")).andRespond(withServerError());

        SynthesisAttempt attempt = synthesizer("test-key").attempt("timeout", docs, incidents);

        assertFalse(attempt.isSuccess());
        assertEquals(SynthesisFailure.HTTP_STATUS, attempt.failure());
    }

    @Test
    void testTransportFailureReason() {
        server.expect(requestTo(BASE_URL + "/responses")).andRespond(request -> {
            throw new SocketTimeoutException("Read timed out");
        });
        LlmSynthesizer llm = synthesizer("test-key");

        SynthesisAttempt attempt = llm.attempt("timeout", docs, incidents);

        assertEquals(SynthesisFailure.TRANSPORT, attempt.failure());
        assertNull(attempt.result());
    }

    @Test
    void testTransportFailureResultIsDeterministic() {
        server.expect(requestTo(BASE_URL + "/responses")).andRespond(request -> {
            throw new SocketTimeoutException("Read timed out");
        });

        AgentResult result = synthesizer("test-key").synthesize("timeout", docs, incidents);

        server.verify();
        assertEquals(deterministic.synthesize("timeout", docs, incidents), result);
    }

    @Test
    void testEmptyTextReason() {
        respondWith("""
                {"output": [{"type": "message", "content": [{"type": "refusal", "refusal": "no"}]}]}
                """);

        SynthesisAttempt attempt = synthesizer("test-key").attempt("timeout", docs, incidents);

        assertEquals(SynthesisFailure.EMPTY_TEXT, attempt.failure());
    }

    @Test
    void testMalformedJsonReason() {
        respondWith("""
                {"output_text": "Sure! Here is my answer: not json"}
                """);

        SynthesisAttempt attempt = synthesizer("test-key").attempt("timeout", docs, incidents);

        assertEquals(SynthesisFailure.MALFORMED_JSON, attempt.failure());
    }

    @Test
    void testSchemaMismatchFallsBack() {
        respondWith("""
                {"output_text": "{\\"summary\\": \\"S\\", \\"steps\\": \\"not a list\\"}"}
                """);

        LlmSynthesizer llm = synthesizer("test-key");
        AgentResult result = llm.synthesize("timeout", docs, incidents);

        assertEquals(deterministic.synthesize("timeout", docs, incidents), result);
    }

    @Test
    void testNonJsonBodyReason() {
        server.expect(requestTo(BASE_URL + "/responses"))
                .andRespond(withSuccess("<html>gateway</html>", MediaType.TEXT_HTML));

        SynthesisAttempt attempt = synthesizer("test-key").attempt("timeout", docs, incidents);

        assertEquals(SynthesisFailure.MALFORMED_RESPONSE, attempt.failure());
    }

    @Test
    void testSchemaValidation() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals(SynthesisFailure.SCHEMA_MISMATCH,
                LlmSynthesizer.toResult(mapper.readTree("[1, 2]")).failure());
        assertEquals(SynthesisFailure.SCHEMA_MISMATCH,
                LlmSynthesizer.toResult(mapper.readTree("{\"steps\": []}")).failure());
        assertEquals(SynthesisFailure.SCHEMA_MISMATCH,
                LlmSynthesizer.toResult(mapper.readTree("{\"summary\": 3}")).failure());
        assertEquals(SynthesisFailure.SCHEMA_MISMATCH,
                LlmSynthesizer.toResult(mapper.readTree("{\"summary\": \"s\", \"sources\": [1]}")).failure());
        assertTrue(LlmSynthesizer.toResult(mapper.readTree("{\"summary\": \"s\", \"extra\": true}")).isSuccess());
    }

    @Test
    void testPromptEmbedsQuestionAndResults() {
        String prompt = synthesizer("test-key").buildPrompt("Why does the DB time out?", docs, incidents);

        assertTrue(prompt.startsWith("User question: Why does the DB time out?"));
        assertTrue(prompt.contains("\"filename\" : \"db.md\""));
        assertTrue(prompt.contains("\"id\" : \"INC-001\""));
        assertTrue(prompt.contains("Respond with JSON:"));
    }
}
