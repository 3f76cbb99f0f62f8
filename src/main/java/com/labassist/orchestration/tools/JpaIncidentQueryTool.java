package com.labassist.orchestration.tools;

import com.labassist.entity.Incident;
import com.labassist.orchestration.model.IncidentHit;
import com.labassist.repository.IncidentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code query_incidents} against the incident table of the request store.
 */
@Component
@RequiredArgsConstructor
public class JpaIncidentQueryTool implements IncidentQueryTool {

    static final int MAX_RESULTS = 5;

    private final IncidentRepository incidentRepository;

    @Override
    public List<IncidentHit> query(String query) {
        List<String> keywords = QueryKeywords.of(query);
        if (keywords.isEmpty()) {
            return List.of();
        }
        Map<String, Incident> incidents = new LinkedHashMap<>();
        Map<String, Integer> matches = new LinkedHashMap<>();
        try {
            for (String keyword : keywords) {
                for (Incident incident : incidentRepository.searchByPattern(containsPattern(keyword))) {
                    incidents.putIfAbsent(incident.getId(), incident);
                    matches.merge(incident.getId(), 1, Integer::sum);
                }
            }
        } catch (DataAccessException ex) {
            throw new ToolUnavailableException(ToolName.QUERY_INCIDENTS,
                    "Incident store could not be queried: " + ex.getMessage(), ex);
        }
        Comparator<Incident> byMatches = Comparator.comparingInt(i -> matches.get(i.getId()));
        Comparator<Incident> byRecency = Comparator.comparing(Incident::getOccurredAt,
                Comparator.nullsFirst(Comparator.<OffsetDateTime>naturalOrder()));
        return incidents.values().stream()
                .sorted(byMatches.reversed().thenComparing(byRecency.reversed()).thenComparing(Incident::getId))
                .limit(MAX_RESULTS)
                .map(i -> new IncidentHit(i.getId(), i.getTitle(), i.getDescription(), i.getSeverity(), i.getResolution()))
                .toList();
    }

    static String containsPattern(String keyword) {
        String escaped = keyword.replace("!", "!!").replace("%", "!%").replace("_", "!_");
        return "%" + escaped + "%";
    }
}
