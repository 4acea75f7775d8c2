package com.libraryindex.agent.core;

import com.libraryindex.agent.config.ResearchProperties;
import com.libraryindex.agent.exception.LlmUnavailableException;
import com.libraryindex.agent.llm.CompletionOptions;
import com.libraryindex.agent.model.LlmResponse;
import com.libraryindex.agent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Binary-tree synthesis: merges N analyses in ceil(log2 N) rounds of pairwise
 * model calls.
 *
 * Each round pairs adjacent texts and merges the pairs concurrently on the
 * session's {@link BoundedFanOut}; an odd last text is carried to the next round
 * unmerged. The per-pair token budget is the round's total budget divided by its
 * pair count, clamped to [minPairTokens, maxPairTokens], so wide rounds get
 * shorter merges. A pair that fails, times out or comes back degenerate falls
 * back to the concatenation of its inputs. Texts are never rewritten here: the
 * content filter only decides which inputs and outputs are dropped.
 */
@Component
@Slf4j
public class ResultMerger {

    public static final String PLACEHOLDER = "No content to synthesize.";

    private static final String SYSTEM_PROMPT = """
            You are an expert at integrating academic findings. Merge the two research notes
            the user provides into one structured, coherent text:
            - keep every important finding and the evidence for it
            - remove redundancy
            - reorganize by logical relationship and make connections between the notes explicit
            - keep the result within %d tokens
            Output only the merged text.
            """;

    private final ContentFilter contentFilter;
    private final ResearchProperties.Merge budget;

    public ResultMerger(ContentFilter contentFilter, ResearchProperties properties) {
        this.contentFilter = contentFilter;
        this.budget = properties.getMerge();
    }

    public MergeResult merge(List<String> texts, ResearchContext ctx, BoundedFanOut pool) {
        List<String> level = new ArrayList<>();
        for (String text : texts) {
            if (!contentFilter.isDegenerate(text)) level.add(text);
        }

        if (level.isEmpty()) {
            log.info("[session={}] Nothing to merge, returning placeholder", ctx.getSessionId());
            return new MergeResult(PLACEHOLDER, 0, 0, true, false);
        }
        if (level.size() == 1) {
            return new MergeResult(level.get(0), 0, 0, false, false);
        }

        log.info("[session={}] Merging {} analyses", ctx.getSessionId(), level.size());
        int rounds = 0;
        int fallbacks = 0;

        while (level.size() > 1) {
            if (ctx.isCancellationRequested()) {
                return new MergeResult(String.join("\n\n", level), rounds, fallbacks, false, true);
            }
            rounds++;

            List<Pair> pairs = new ArrayList<>();
            for (int i = 0; i + 1 < level.size(); i += 2) {
                pairs.add(new Pair(level.get(i), level.get(i + 1)));
            }
            String carried = level.size() % 2 == 1 ? level.get(level.size() - 1) : null;
            int maxTokens = pairBudget(pairs.size());

            log.info("[session={}] Merge round {}: {} pairs{}, {} tokens per pair",
                    ctx.getSessionId(), rounds, pairs.size(), carried != null ? " + 1 carried" : "", maxTokens);

            List<BoundedFanOut.Outcome<String>> outcomes =
                    pool.runAll(pairs, pair -> mergePair(pair, maxTokens, ctx));

            List<String> next = new ArrayList<>(pairs.size() + 1);
            LlmUnavailableException fatal = null;
            for (int i = 0; i < outcomes.size(); i++) {
                BoundedFanOut.Outcome<String> outcome = outcomes.get(i);
                if (outcome.succeeded() && !contentFilter.isDegenerate(outcome.value())) {
                    next.add(outcome.value());
                    continue;
                }
                if (outcome.error() instanceof LlmUnavailableException e) {
                    fatal = e;
                }
                fallbacks++;
                String reason = outcome.succeeded() ? "degenerate merge output"
                        : outcome.timedOut() ? "timed out" : outcome.error().getMessage();
                log.warn("[session={}] Merge round {} pair {} fell back to concatenation: {}",
                        ctx.getSessionId(), rounds, i, reason);
                ctx.record(HistoryEntry.of(ResearchState.SYNTHESIZING,
                        "Merge round " + rounds + " pair " + i + " failed: " + reason));
                next.add(concatenate(pairs.get(i)));
            }
            if (fatal != null) {
                throw fatal;
            }
            if (carried != null) {
                next.add(carried);
            }
            level = next;
        }

        log.info("[session={}] Merge finished: {} rounds, {} fallbacks, {} chars",
                ctx.getSessionId(), rounds, fallbacks, level.get(0).length());
        return new MergeResult(level.get(0), rounds, fallbacks, false, false);
    }

    int pairBudget(int pairCount) {
        int share = budget.getTotalTokenBudget() / Math.max(1, pairCount);
        return Math.max(budget.getMinPairTokens(), Math.min(budget.getMaxPairTokens(), share));
    }

    private String mergePair(Pair pair, int maxTokens, ResearchContext ctx) {
        String user = "## Research question\n" + ctx.getQuery()
                + "\n\n## Note A\n" + pair.first()
                + "\n\n## Note B\n" + pair.second()
                + "\n\nMerge the two notes around the research question.";

        LlmResponse response = ctx.getSynthesisLlm().complete(
                List.of(Message.system(SYSTEM_PROMPT.formatted(maxTokens)), Message.user(user)),
                CompletionOptions.builder().maxTokens(maxTokens).temperature(0.3).build());
        ctx.getRunContext().addTokens(response.getPromptTokens(), response.getCompletionTokens());
        return response.getContent();
    }

    private static String concatenate(Pair pair) {
        return pair.first() + "\n\n" + pair.second();
    }

    private record Pair(String first, String second) {
        @Override
        public String toString() {
            return "Pair[" + first.length() + "+" + second.length() + " chars]";
        }
    }
}
