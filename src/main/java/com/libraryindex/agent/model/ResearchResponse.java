package com.libraryindex.agent.model;

import com.libraryindex.agent.core.HistoryEntry;
import com.libraryindex.agent.core.ResearchState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchResponse {

    private String sessionId;
    private ResearchState finalState;

    /** Synthesized report; on failure, whatever partial report existed (may be null). */
    private String report;

    /** Present only when finalState is FAILED. */
    private String failureDetail;

    private int searchAttempts;
    private int papersFound;
    private int papersAnalyzed;
    private double successRate;
    private boolean lowQuality;

    @Builder.Default
    private List<HistoryEntry> history = new ArrayList<>();

    public boolean isCompleted() {
        return finalState == ResearchState.COMPLETED;
    }
}
