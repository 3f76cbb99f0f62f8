package com.labassist.orchestration.synthesis;

import com.labassist.orchestration.model.AgentResult;
import com.labassist.orchestration.model.DocHit;
import com.labassist.orchestration.model.IncidentHit;

import java.util.List;

/**
 * Turns raw retrieval output into the final answer. Implementations never
 * throw for content reasons; every call yields a result.
 */
public interface ResultSynthesizer {

    AgentResult synthesize(String text, List<DocHit> docResults, List<IncidentHit> incidentResults);
}
