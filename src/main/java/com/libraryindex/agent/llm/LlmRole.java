package com.libraryindex.agent.llm;

/** The three jobs a session hands to a language model. */
public enum LlmRole {
    /** keyword extraction, arXiv query generation, refinement */
    QUERY_ANALYSIS,
    /** per-paper relevance analysis */
    PAPER_ANALYSIS,
    /** pairwise synthesis merge */
    SYNTHESIS
}
