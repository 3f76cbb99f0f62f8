package com.labassist.orchestration.tools;

import com.labassist.orchestration.model.IncidentHit;

import java.util.List;

/**
 * {@code query_incidents}: lookup of past incidents in the request store.
 */
public interface IncidentQueryTool {

    /**
     * @param query free-text query, never empty
     * @return matching incidents, best first; empty when nothing matches
     * @throws ToolUnavailableException when the incident store cannot be queried
     */
    List<IncidentHit> query(String query);
}
