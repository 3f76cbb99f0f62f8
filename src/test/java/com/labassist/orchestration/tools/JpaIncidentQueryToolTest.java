package com.labassist.orchestration.tools;

import com.labassist.entity.Incident;
import com.labassist.orchestration.model.IncidentHit;
import com.labassist.repository.IncidentRepository;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class JpaIncidentQueryToolTest {

    private final IncidentRepository repository = mock(IncidentRepository.class);
    private final JpaIncidentQueryTool tool = new JpaIncidentQueryTool(repository);

    private static Incident incident(String id, String title, String occurredAt) {
        return Incident.builder()
                .id(id)
                .title(title)
                .resolution("Fixed " + id)
                .severity("high")
                .occurredAt(OffsetDateTime.parse(occurredAt))
                .build();
    }

    @Test
    void testRanksByKeywordMatchesThenRecency() {
        Incident older = incident("INC-1", "Database timeout", "2024-01-01T00:00:00Z");
        Incident newer = incident("INC-2", "Database migration", "2024-06-01T00:00:00Z");
        Incident both = incident("INC-3", "Database connection timeout", "2023-01-01T00:00:00Z");
        when(repository.searchByPattern("%database%")).thenReturn(List.of(older, newer, both));
        when(repository.searchByPattern("%timeout%")).thenReturn(List.of(older, both));

        List<IncidentHit> hits = tool.query("Database TIMEOUT");

        assertEquals(List.of("INC-1", "INC-3", "INC-2"), hits.stream().map(IncidentHit::id).toList());
        assertEquals("Fixed INC-1", hits.get(0).resolution());
    }

    @Test
    void testNoKeywordsNoQuery() {
        assertTrue(tool.query("a to").isEmpty());
        verifyNoInteractions(repository);
    }

    @Test
    void testStoreFailureIsToolUnavailable() {
        when(repository.searchByPattern(anyString())).thenThrow(new DataAccessResourceFailureException("down"));

        ToolUnavailableException ex = assertThrows(ToolUnavailableException.class, () -> tool.query("timeout"));
        assertEquals(ToolName.QUERY_INCIDENTS, ex.getTool());
    }

    @Test
    void testUnderscoreMatchedLiterally() {
        when(repository.searchByPattern(anyString())).thenReturn(List.of());

        tool.query("pool_size");

        verify(repository).searchByPattern("%pool!_size%");
        assertEquals("%100!%!!%", JpaIncidentQueryTool.containsPattern("100%!"));
    }
}
