package com.labassist.orchestration.synthesis;

import com.labassist.orchestration.model.AgentResult;

/**
 * Outcome of one LLM synthesis call: either a result or the reason there is none.
 */
public record SynthesisAttempt(
        AgentResult result,
        SynthesisFailure failure,
        String detail
) {

    public static SynthesisAttempt succeeded(AgentResult result) {
        return new SynthesisAttempt(result, null, null);
    }

    public static SynthesisAttempt failed(SynthesisFailure failure, String detail) {
        return new SynthesisAttempt(null, failure, detail);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
