package com.libraryindex.agent.core;

import lombok.Builder;
import lombok.Value;

/**
 * What the next planning round should do differently.
 */
@Value
@Builder
public class RefinementHints {

    public static final RefinementHints NONE = RefinementHints.builder().build();

    QualityEvaluation.SuggestedAction action;

    /** Free-text guidance for the query generator. */
    String guidance;

    public String describe() {
        if (action == null && (guidance == null || guidance.isBlank())) {
            return "";
        }
        String actionText = switch (action == null ? QualityEvaluation.SuggestedAction.CONTINUE : action) {
            case EXPAND_KEYWORDS -> "Previous searches found nothing; use broader, more general terms.";
            case REFINE_KEYWORDS -> "Previous results were mostly unusable; use more precise terms.";
            case BROADEN_SEARCH -> "Previous searches found few papers; try synonyms and adjacent fields.";
            case CONTINUE -> "";
        };
        return (actionText + (guidance == null ? "" : " " + guidance)).trim();
    }
}
