package com.labassist.orchestration.synthesis;

/**
 * Reasons the LLM strategy could not produce a result.
 */
public enum SynthesisFailure {

    /** No API key configured; no request was sent. */
    MISSING_CREDENTIAL,
    /** The endpoint answered with a non-2xx status. */
    HTTP_STATUS,
    /** Connection, timeout or other I/O failure. */
    TRANSPORT,
    /** The response body was not a JSON document. */
    MALFORMED_RESPONSE,
    /** No answer text could be extracted from the response. */
    EMPTY_TEXT,
    /** The answer text was not valid JSON. */
    MALFORMED_JSON,
    /** The answer JSON did not match {@code {summary, steps, sources}}. */
    SCHEMA_MISMATCH
}
