package com.libraryindex.agent.search;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libraryindex.agent.exception.LlmUnavailableException;
import com.libraryindex.agent.llm.CompletionOptions;
import com.libraryindex.agent.llm.LlmClient;
import com.libraryindex.agent.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns keywords into arXiv search expressions with the query-analysis model.
 *
 * Model output is parsed leniently (JSON array, single-quoted list, or one
 * expression per line) and every expression passes through
 * {@link ArxivQuerySyntax#clean(String)}. When the model fails or produces
 * nothing usable, a plain {@code all:} query built from the keywords is returned.
 * Permanent model failures are not absorbed.
 */
@Slf4j
public class ArxivQueryGenerator {

    static final int MAX_QUERIES = 10;

    private static final String SYSTEM_PROMPT = """
            You are an expert search query generator for the arXiv API.
            Given keywords and optional refinement hints, output a JSON array of search query
            strings that the arXiv API accepts. Every string must follow arXiv API syntax:
            - Use field prefixes ti: (title), au: (author), abs: (abstract), co: (comment),
              jr: (journal reference), cat: (category), rn: (report number), id: (arXiv id),
              all: (all fields).
            - Combine conditions with AND, OR, ANDNOT in capitals. Use '+' instead of spaces.
            - Quote multi-word phrases, e.g. abs:"machine+learning".
            - Only use real arXiv category codes after cat:, e.g. cat:cs.AI or cat:hep-th.
            - Translate non-English terms to English.
            - Prefer several focused queries over one long OR chain. At most 10 queries.
            Output only the array, no prose.
            """;

    private final ObjectMapper objectMapper;
    private final ObjectMapper lenientMapper;

    public ArxivQueryGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.lenientMapper = objectMapper.copy()
                .configure(JsonParser.Feature.ALLOW_SINGLE_QUOTES, true);
    }

    public List<String> generate(LlmClient llm, String keywords, String hints) {
        if (keywords == null || keywords.isBlank()) {
            log.warn("Query generation skipped: no keywords");
            return List.of();
        }

        String user = "Keywords: " + keywords.trim()
                + (hints == null || hints.isBlank() ? "" : "\nRefinement hints: " + hints.trim())
                + "\nGenerate the arXiv search queries.";

        try {
            String content = llm.complete(
                    List.of(Message.system(SYSTEM_PROMPT), Message.user(user)),
                    CompletionOptions.temperature(0.3)).getContent();

            List<String> queries = cleanAll(parse(content));
            if (!queries.isEmpty()) {
                log.info("Generated {} arXiv queries: {}", queries.size(), queries);
                return queries;
            }
            log.warn("Model produced no valid arXiv query, using keyword fallback");
        } catch (LlmUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("arXiv query generation failed, using keyword fallback: {}", e.getMessage());
        }

        String fallback = ArxivQuerySyntax.fallbackQuery(keywords);
        return fallback == null ? List.of() : List.of(fallback);
    }

    List<String> parse(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        String text = stripCodeFence(content.trim());

        int open = text.indexOf('[');
        int close = text.lastIndexOf(']');
        if (open >= 0 && close > open) {
            String array = text.substring(open, close + 1);
            for (ObjectMapper mapper : List.of(objectMapper, lenientMapper)) {
                try {
                    return mapper.readValue(array, new TypeReference<List<String>>() {});
                } catch (Exception e) {
                    log.debug("List parse failed with {}: {}", mapper == objectMapper ? "strict" : "lenient", e.getMessage());
                }
            }
        }

        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String candidate = line.trim()
                    .replaceFirst("^[-*\\d.)\\s]+(?=\\S)", "")
                    .replaceAll("^[\"'`,]+|[\"'`,]+$", "")
                    .trim();
            if (candidate.contains(":")) {
                lines.add(candidate);
            }
        }
        return lines;
    }

    private static List<String> cleanAll(List<String> raw) {
        Set<String> cleaned = new LinkedHashSet<>();
        for (String q : raw) {
            String c = ArxivQuerySyntax.clean(q);
            if (c != null) {
                cleaned.add(c);
            } else {
                log.debug("Dropped invalid arXiv query: {}", q);
            }
            if (cleaned.size() == MAX_QUERIES) break;
        }
        return new ArrayList<>(cleaned);
    }

    private static String stripCodeFence(String text) {
        if (!text.startsWith("```")) return text;
        int firstNewline = text.indexOf('\n');
        int end = text.lastIndexOf("```");
        if (firstNewline < 0 || end <= firstNewline) return text.replace("```", "");
        return text.substring(firstNewline + 1, end).trim();
    }
}
