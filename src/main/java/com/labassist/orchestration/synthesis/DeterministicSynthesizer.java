package com.labassist.orchestration.synthesis;

import com.labassist.orchestration.model.AgentResult;
import com.labassist.orchestration.model.DocHit;
import com.labassist.orchestration.model.IncidentHit;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Template-based synthesis with no external dependency. Output depends only on
 * the arguments.
 */
@Component
public class DeterministicSynthesizer implements ResultSynthesizer {

    static final int MAX_ENTRIES = 3;
    static final int MAX_KEY_POINTS = 2;
    static final int MAX_EXCERPT = 100;

    static final String DOCS_HEADER = "Based on the documentation:";
    static final String INCIDENTS_HEADER = "\nRelevant past incidents:";
    static final String NO_RESULTS_SUMMARY = "No specific documentation or incidents found for this query.";
    static final String NO_RESULTS_STEP = "Please provide more details about your request.";

    @Override
    public AgentResult synthesize(String text, List<DocHit> docResults, List<IncidentHit> incidentResults) {
        List<String> lines = new ArrayList<>();
        List<String> steps = new ArrayList<>();
        List<String> sources = new ArrayList<>();

        if (docResults != null && !docResults.isEmpty()) {
            lines.add(DOCS_HEADER);
            for (DocHit doc : docResults.subList(0, Math.min(MAX_ENTRIES, docResults.size()))) {
                lines.add("- " + nullToEmpty(doc.title()) + ": " + excerpt(doc.snippet()) + "...");
                List<String> keyPoints = doc.keyPoints();
                steps.addAll(keyPoints.subList(0, Math.min(MAX_KEY_POINTS, keyPoints.size())));
                sources.add(doc.filename());
            }
        }

        if (incidentResults != null && !incidentResults.isEmpty()) {
            lines.add(INCIDENTS_HEADER);
            for (IncidentHit incident : incidentResults.subList(0, Math.min(MAX_ENTRIES, incidentResults.size()))) {
                lines.add("- " + incident.id() + ": " + nullToEmpty(incident.title()));
                if (StringUtils.hasLength(incident.resolution())) {
                    steps.add("From " + incident.id() + ": " + excerpt(incident.resolution()));
                }
                sources.add(incident.id());
            }
        }

        if (lines.isEmpty()) {
            lines.add(NO_RESULTS_SUMMARY);
            steps = List.of(NO_RESULTS_STEP);
        }

        return AgentResult.normalized(String.join(" ", lines), steps, sources);
    }

    private static String excerpt(String value) {
        String safe = nullToEmpty(value);
        return safe.length() <= MAX_EXCERPT ? safe : safe.substring(0, MAX_EXCERPT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
