package com.labassist.orchestration.synthesis;

import com.labassist.orchestration.model.AgentResult;
import com.labassist.orchestration.model.DocHit;
import com.labassist.orchestration.model.IncidentHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Picks the synthesis strategy from {@link SynthesisSettings#useLlm()}.
 */
@Service
@Slf4j
public class SynthesisEngine {

    private final ResultSynthesizer strategy;

    public SynthesisEngine(SynthesisSettings settings,
                           DeterministicSynthesizer deterministicSynthesizer,
                           LlmSynthesizer llmSynthesizer) {
        this.strategy = settings.useLlm() ? llmSynthesizer : deterministicSynthesizer;
        log.info("Synthesis strategy: {} ({})", strategy.getClass().getSimpleName(), settings);
    }

    public AgentResult synthesize(String text, List<DocHit> docResults, List<IncidentHit> incidentResults) {
        return strategy.synthesize(text, docResults, incidentResults);
    }
}
