package com.libraryindex.agent.core;

import lombok.Builder;
import lombok.Value;

/**
 * Result of scoring one search round.
 */
@Value
@Builder
public class QualityEvaluation {

    public enum SuggestedAction {
        /** nothing found: use broader, more general terms */
        EXPAND_KEYWORDS,
        /** analyses mostly failed: sharpen the terms */
        REFINE_KEYWORDS,
        /** too few papers: try synonyms and adjacent fields */
        BROADEN_SEARCH,
        CONTINUE
    }

    int papersFound;
    int papersAnalyzed;
    double successRate;
    double searchEfficiency;
    SuggestedAction suggestedAction;

    public boolean isInsufficient() {
        return suggestedAction != SuggestedAction.CONTINUE;
    }
}
