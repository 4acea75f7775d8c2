package com.libraryindex.agent.core;

/**
 * States of one research session. Exactly one is active at a time.
 */
public enum ResearchState {
    INITIALIZING,
    ANALYZING_QUERY,
    PLANNING_SEARCH,
    EXECUTING_SEARCH,
    PROCESSING_RESULTS,
    EVALUATING_RESULTS,
    REFINING_STRATEGY,
    SYNTHESIZING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
