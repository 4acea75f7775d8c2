package com.libraryindex.agent.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validation and normalization of arXiv search expressions produced by a model.
 *
 * An expression is a sequence of {@code prefix:term} segments joined by
 * {@code +AND+}, {@code +OR+} or {@code +ANDNOT+}. Models routinely invent
 * prefixes ("title:") and categories ("cat:cs.GNN"); those are repaired or
 * removed here rather than sent to the API.
 */
public final class ArxivQuerySyntax {

    public static final Set<String> FIELD_PREFIXES = Set.of(
            "ti", "au", "abs", "co", "jr", "cat", "rn", "id", "all");

    static final Map<String, String> PREFIX_SYNONYMS = Map.ofEntries(
            Map.entry("title", "ti"),
            Map.entry("author", "au"),
            Map.entry("authors", "au"),
            Map.entry("abstract", "abs"),
            Map.entry("summary", "abs"),
            Map.entry("comment", "co"),
            Map.entry("journal", "jr"),
            Map.entry("journal_ref", "jr"),
            Map.entry("category", "cat"),
            Map.entry("categories", "cat"),
            Map.entry("report", "rn"),
            Map.entry("report_number", "rn"),
            Map.entry("any", "all"));

    public static final Set<String> CATEGORIES = Set.of(
            "cs.AI", "cs.AR", "cs.CC", "cs.CE", "cs.CG", "cs.CL", "cs.CR", "cs.CV", "cs.CY",
            "cs.DB", "cs.DC", "cs.DL", "cs.DM", "cs.DS", "cs.ET", "cs.FL", "cs.GL", "cs.GR",
            "cs.GT", "cs.HC", "cs.IR", "cs.IT", "cs.LG", "cs.LO", "cs.MA", "cs.MM", "cs.MS",
            "cs.NA", "cs.NE", "cs.NI", "cs.OH", "cs.OS", "cs.PF", "cs.PL", "cs.RO", "cs.SC",
            "cs.SD", "cs.SE", "cs.SI", "cs.SY",
            "stat.AP", "stat.CO", "stat.ME", "stat.ML", "stat.OT", "stat.TH",
            "math.AC", "math.AG", "math.AP", "math.AT", "math.CA", "math.CO", "math.CT",
            "math.CV", "math.DG", "math.DS", "math.FA", "math.GM", "math.GN", "math.GR",
            "math.GT", "math.HO", "math.IT", "math.KT", "math.LO", "math.MG", "math.MP",
            "math.NA", "math.NT", "math.OA", "math.OC", "math.PR", "math.QA", "math.RA",
            "math.RT", "math.SG", "math.SP", "math.ST",
            "eess.AS", "eess.IV", "eess.SP", "eess.SY",
            "econ.EM", "econ.GN", "econ.TH",
            "q-bio.BM", "q-bio.CB", "q-bio.GN", "q-bio.MN", "q-bio.NC", "q-bio.OT",
            "q-bio.PE", "q-bio.QM", "q-bio.SC", "q-bio.TO",
            "q-fin.CP", "q-fin.EC", "q-fin.GN", "q-fin.MF", "q-fin.PM", "q-fin.PR",
            "q-fin.RM", "q-fin.ST", "q-fin.TR",
            "astro-ph", "astro-ph.CO", "astro-ph.EP", "astro-ph.GA", "astro-ph.HE",
            "astro-ph.IM", "astro-ph.SR",
            "cond-mat.dis-nn", "cond-mat.mes-hall", "cond-mat.mtrl-sci", "cond-mat.other",
            "cond-mat.quant-gas", "cond-mat.soft", "cond-mat.stat-mech", "cond-mat.str-el",
            "cond-mat.supr-con",
            "physics.acc-ph", "physics.ao-ph", "physics.app-ph", "physics.atm-clus",
            "physics.atom-ph", "physics.bio-ph", "physics.chem-ph", "physics.class-ph",
            "physics.comp-ph", "physics.data-an", "physics.ed-ph", "physics.flu-dyn",
            "physics.gen-ph", "physics.geo-ph", "physics.hist-ph", "physics.ins-det",
            "physics.med-ph", "physics.optics", "physics.plasm-ph", "physics.pop-ph",
            "physics.soc-ph", "physics.space-ph",
            "gr-qc", "hep-ex", "hep-lat", "hep-ph", "hep-th", "math-ph", "nlin.AO",
            "nlin.CD", "nlin.CG", "nlin.PS", "nlin.SI", "nucl-ex", "nucl-th", "quant-ph");

    private static final Pattern OPERATOR = Pattern.compile("\\+(AND|OR|ANDNOT)\\+", Pattern.CASE_INSENSITIVE);

    private ArxivQuerySyntax() {
    }

    /**
     * @return the cleaned expression, or null when nothing valid remains
     */
    public static String clean(String query) {
        if (query == null) return null;
        String trimmed = query.trim().replace(' ', '+');
        if (trimmed.isEmpty()) return null;

        List<String> segments = new ArrayList<>();
        List<String> operators = new ArrayList<>();
        split(trimmed, segments, operators);

        for (int i = 0; i < segments.size(); i++) {
            String normalized = normalizeSegment(segments.get(i));
            if (normalized == null) {
                return null;
            }
            segments.set(i, normalized);
        }

        boolean hasAnd = operators.stream().anyMatch(op -> op.equals("AND") || op.equals("ANDNOT"));
        boolean hasOr = operators.contains("OR");
        boolean anyInvalidCategory = segments.stream().anyMatch(ArxivQuerySyntax::isInvalidCategory);

        // Dropping a term from a mixed AND/OR expression changes its meaning.
        if (hasAnd && hasOr && anyInvalidCategory) {
            return null;
        }

        StringBuilder out = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            if (isInvalidCategory(segment)) {
                continue;
            }
            if (out.length() > 0) {
                out.append('+').append(operators.get(i - 1)).append('+');
            }
            out.append(segment);
        }

        String result = stripPluses(out.toString());
        return result.isEmpty() ? null : result;
    }

    /** Plain keywords → an {@code all:} expression, used when generation fails. */
    public static String fallbackQuery(String keywords) {
        String terms = keywords == null ? "" : keywords.trim()
                .replaceAll("[\\p{Punct}&&[^\\-]]+", " ")
                .trim()
                .replaceAll("\\s+", "+");
        return terms.isEmpty() ? null : "all:" + terms;
    }

    private static void split(String query, List<String> segments, List<String> operators) {
        Matcher m = OPERATOR.matcher(query);
        int last = 0;
        while (m.find()) {
            segments.add(query.substring(last, m.start()));
            operators.add(m.group(1).toUpperCase(Locale.ROOT));
            last = m.end();
        }
        segments.add(query.substring(last));
    }

    private static String normalizeSegment(String segment) {
        String s = stripPluses(segment.trim());
        if (s.isEmpty()) return null;

        int colon = s.indexOf(':');
        if (colon < 0) {
            return s;
        }
        String prefix = s.substring(0, colon).toLowerCase(Locale.ROOT);
        String rest = s.substring(colon + 1);
        String leadingParen = "";
        while (prefix.startsWith("(")) {
            leadingParen += "(";
            prefix = prefix.substring(1);
        }
        prefix = PREFIX_SYNONYMS.getOrDefault(prefix, prefix);
        if (!FIELD_PREFIXES.contains(prefix) || rest.isBlank()) {
            return null;
        }
        return leadingParen + prefix + ":" + rest;
    }

    private static boolean isInvalidCategory(String segment) {
        String s = segment.replace("(", "").replace(")", "");
        if (!s.toLowerCase(Locale.ROOT).startsWith("cat:")) {
            return false;
        }
        return !CATEGORIES.contains(s.substring(4));
    }

    private static String stripPluses(String s) {
        int start = 0, end = s.length();
        while (start < end && s.charAt(start) == '+') start++;
        while (end > start && s.charAt(end - 1) == '+') end--;
        return s.substring(start, end);
    }
}
