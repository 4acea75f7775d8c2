package com.libraryindex.agent.core;

import lombok.Data;

/**
 * Paper yield counters of a session. Updated by the orchestrator after each barrier.
 */
@Data
public class QualityMetrics {

    private int papersFound;
    private int papersAnalyzed;
    private int papersFailed;

    public int papersProcessed() {
        return papersAnalyzed + papersFailed;
    }
}
