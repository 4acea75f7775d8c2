package com.libraryindex.agent.core;

import com.libraryindex.agent.config.ResearchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects "nothing found" answers that models emit instead of content.
 *
 * The filter only classifies; it never rewrites a text. A sentence counts as
 * boilerplate when a "no results" phrase makes up at least half of it, so a
 * real finding that mentions an empty ablation is left alone. A text is
 * degenerate when boilerplate sentences exceed {@code max-invalid-ratio} of its
 * sentences, or when the remaining sentences hold fewer than
 * {@code min-content-chars} characters.
 */
@Component
@Slf4j
public class ContentFilter {

    private static final List<Pattern> BOILERPLATE = compile(
            "no\\s+(matching|relevant|appropriate|corresponding)[^.!?\\n]*(information|data|content|results?)",
            "not\\s+able\\s+to\\s+find[^.!?\\n]*(matching|relevant|appropriate|corresponding)[^.!?\\n]*(results?|data|content)",
            "could\\s+not\\s+find[^.!?\\n]*(matching|relevant|appropriate|corresponding)[^.!?\\n]*(records?|results?|data)",
            "did\\s+not\\s+return\\s+any\\s+(results?|data|records?|match(es)?)",
            "returned\\s+no\\s+(results?|data|records?|match(es)?)",
            "search\\s+results?\\s+(are|is)\\s+empty",
            "no\\s+results?\\s+found",
            "nothing\\s+found",
            "there\\s+is\\s+no\\s+(data|result|record|match)",
            "currently\\s+no\\s+(data|results?|records?|match(es)?)",
            "no\\s+available\\s+(data|information|content)",
            "unable\\s+to\\s+retrieve\\s+(data|information|content)",
            "no\\s+matching\\s+entries\\s+found",
            "no\\s+entries\\s+match\\s+your\\s+criteria");

    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+|\\n+");

    private final double maxInvalidRatio;
    private final int minContentChars;

    public ContentFilter(ResearchProperties properties) {
        this(properties.getFilter().getMaxInvalidRatio(), properties.getFilter().getMinContentChars());
    }

    ContentFilter(double maxInvalidRatio, int minContentChars) {
        this.maxInvalidRatio = maxInvalidRatio;
        this.minContentChars = minContentChars;
    }

    public boolean isDegenerate(String content) {
        if (content == null || content.isBlank()) {
            return true;
        }

        List<String> sentences = Arrays.stream(SENTENCE_BREAK.split(content.strip()))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();

        int boilerplate = 0;
        int substantiveChars = 0;
        for (String sentence : sentences) {
            if (isBoilerplate(sentence)) {
                boilerplate++;
            } else {
                substantiveChars += sentence.length();
            }
        }

        if (boilerplate > sentences.size() * maxInvalidRatio) {
            log.debug("Content degenerate: {} boilerplate sentences of {}", boilerplate, sentences.size());
            return true;
        }
        if (substantiveChars < minContentChars) {
            log.debug("Content degenerate: {} substantive chars", substantiveChars);
            return true;
        }
        return false;
    }

    static boolean isBoilerplate(String sentence) {
        for (Pattern p : BOILERPLATE) {
            Matcher m = p.matcher(sentence);
            if (m.find() && (m.end() - m.start()) * 2 >= sentence.length()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r + "[.!?]*", Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
