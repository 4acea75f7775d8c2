package com.libraryindex.agent.core;

/**
 * Lifecycle of a paper within a session: PENDING → FETCHED → ANALYZED, or → FAILED
 * from any non-terminal status. A cache hit goes straight from PENDING to ANALYZED.
 */
public enum PaperStatus {
    PENDING(0),
    FETCHED(1),
    ANALYZED(2),
    FAILED(2);

    private final int rank;

    PaperStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return rank == 2;
    }

    public boolean canAdvanceTo(PaperStatus next) {
        return !isTerminal() && next.rank > rank;
    }
}
