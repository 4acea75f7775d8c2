package com.libraryindex.agent.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * One immutable line of a session's history. {@code queries} lists the search
 * expressions issued in that step, if any; the planner reads them to avoid
 * repeating a search.
 */
@Value
@Builder
@Jacksonized
public class HistoryEntry {

    ResearchState state;
    Instant timestamp;
    String summary;

    @Singular
    List<String> queries;

    public static HistoryEntry of(ResearchState state, String summary) {
        return HistoryEntry.builder()
                .state(state)
                .timestamp(Instant.now())
                .summary(summary)
                .build();
    }
}
