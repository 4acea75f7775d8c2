package com.libraryindex.agent.cache;

import java.util.Optional;

/**
 * Memory-cache capability: per-paper analyses shared across sessions.
 *
 * Concurrent analyzers may race on the same paper id; last write wins and
 * any equivalent analysis is acceptable, so no locking is done.
 */
public interface AnalysisCache {

    Optional<String> lookup(String paperId);

    void store(String paperId, String analysis);

    /** Write, read back and delete a throwaway entry. */
    boolean healthCheck();

    String describe();
}
