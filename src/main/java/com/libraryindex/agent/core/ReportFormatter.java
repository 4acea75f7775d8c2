package com.libraryindex.agent.core;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders the final Markdown report of a session.
 */
@Component
public class ReportFormatter {

    public String format(ResearchContext ctx, MergeResult merge, QualityEvaluation evaluation, boolean lowQuality) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Research report\n\n");
        sb.append("**Question:** ").append(ctx.getQuery()).append("\n\n");

        sb.append("## Execution overview\n");
        sb.append("- Search rounds: ").append(ctx.getSearchAttempts() + 1).append('\n');
        sb.append("- Papers found: ").append(evaluation.getPapersFound()).append('\n');
        sb.append("- Papers analyzed: ").append(evaluation.getPapersAnalyzed()).append('\n');
        sb.append("- Analysis success rate: ")
                .append(String.format(Locale.ROOT, "%.1f%%", evaluation.getSuccessRate() * 100)).append('\n');
        if (merge.rounds() > 0) {
            sb.append("- Synthesis merge rounds: ").append(merge.rounds()).append('\n');
        }
        sb.append('\n');

        if (lowQuality) {
            sb.append("> **Note:** result quality is low (")
                    .append(describe(evaluation.getSuggestedAction()))
                    .append("). Consider more general or related keywords, or adjacent research fields.\n\n");
        }

        sb.append("## Findings\n");
        sb.append(merge.text()).append('\n');
        return sb.toString();
    }

    /** Unmerged partial results, used when a session ends without synthesis. */
    public String formatPartial(ResearchContext ctx, List<String> partialResults) {
        if (partialResults.isEmpty()) {
            return null;
        }
        return "# Partial research report\n\n**Question:** " + ctx.getQuery() + "\n\n"
                + String.join("\n\n---\n\n", partialResults) + '\n';
    }

    private static String describe(QualityEvaluation.SuggestedAction action) {
        return switch (action) {
            case EXPAND_KEYWORDS -> "no papers found";
            case REFINE_KEYWORDS -> "most papers could not be analyzed";
            case BROADEN_SEARCH -> "few papers found";
            case CONTINUE -> "sufficient";
        };
    }
}
