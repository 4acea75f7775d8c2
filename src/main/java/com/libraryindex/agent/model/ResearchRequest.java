package com.libraryindex.agent.model;

import com.libraryindex.agent.llm.ModelSelection;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request configuration for one research session.
 * Every optional field falls back to the {@code research.*} / {@code llm.*} configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchRequest {

    @NotBlank(message = "query must not be blank")
    private String query;

    /** Optional; appended to the extracted keywords before the first planning round. */
    private String additionalKeywords;

    /** Optional caller-chosen session id, used for cancellation and trace lookup. */
    private String sessionId;

    private ModelSelection queryAnalysisModel;
    private ModelSelection paperAnalysisModel;
    private ModelSelection synthesisModel;

    @Min(1) @Max(64)
    private Integer maxWorkers;

    @Min(0) @Max(10)
    private Integer maxSearchRetries;
}
