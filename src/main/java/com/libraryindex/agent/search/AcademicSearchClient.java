package com.libraryindex.agent.search;

import com.libraryindex.agent.document.RawDocument;

import java.util.List;

/**
 * Academic-search capability.
 *
 * Both operations throw on failure; callers decide whether a failure is
 * isolated (one query string, one paper) or fatal.
 */
public interface AcademicSearchClient {

    /**
     * @param query      provider-native query expression
     * @param maxResults upper bound on returned records
     */
    List<PaperMetadata> searchMetadata(String query, int maxResults);

    /** Downloads the full text document (PDF) for a paper. */
    RawDocument fetchDocument(PaperMetadata metadata);
}
