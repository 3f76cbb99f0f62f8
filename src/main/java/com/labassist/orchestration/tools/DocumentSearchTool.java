package com.labassist.orchestration.tools;

import com.labassist.orchestration.model.DocHit;

import java.util.List;

/**
 * {@code search_docs}: full-text lookup over the lab documentation corpus.
 */
public interface DocumentSearchTool {

    /**
     * @param query free-text query, never empty
     * @return matching documents, best first; empty when nothing matches
     * @throws ToolUnavailableException when the corpus cannot be read
     */
    List<DocHit> search(String query);
}
