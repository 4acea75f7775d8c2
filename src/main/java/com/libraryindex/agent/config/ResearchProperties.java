package com.libraryindex.agent.config;

import com.libraryindex.agent.cache.CacheProvider;
import com.libraryindex.agent.search.SearchProvider;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Strongly-typed configuration for the research engine.
 * Bound from application.yml under the "research" prefix.
 */
@ConfigurationProperties(prefix = "research")
@Data
public class ResearchProperties {

    private Orchestration orchestration = new Orchestration();
    private Search search = new Search();
    private Merge merge = new Merge();
    private Filter filter = new Filter();
    private Relevance relevance = new Relevance();
    private Cache cache = new Cache();
    private Document document = new Document();
    private Http http = new Http();

    @Data
    public static class Orchestration {
        /** Simultaneous in-flight analyses / pair merges per session */
        private int maxWorkers = 8;
        /** Refinement ceiling; planning rounds never exceed maxSearchRetries + 1 */
        private int maxSearchRetries = 2;
        /** Below this analysis success rate the session refines (while attempts remain) */
        private double minSuccessRate = 0.3;
        /** Fewer papers than this counts as low yield */
        private int minSearchResults = 3;
        /** Per-unit timeout for one paper analysis or one pair merge */
        private Duration unitTimeout = Duration.ofMinutes(2);
    }

    @Data
    public static class Search {
        private SearchProvider provider = SearchProvider.ARXIV;
        private int maxResultsPerQuery = 5;
        /** Minimum interval between calls to the academic search API */
        private Duration minInterval = Duration.ofSeconds(3);
        private Arxiv arxiv = new Arxiv();

        @Data
        public static class Arxiv {
            private String baseUrl = "https://export.arxiv.org";
            private String queryPath = "/api/query";
            private String pdfBaseUrl = "https://arxiv.org/pdf";
        }
    }

    @Data
    public static class Merge {
        /** Token budget shared by all pair merges of one round */
        private int totalTokenBudget = 8000;
        private int minPairTokens = 500;
        private int maxPairTokens = 4000;
    }

    @Data
    public static class Filter {
        /** A text whose "no results" sentences exceed this share of all sentences is degenerate */
        private double maxInvalidRatio = 0.5;
        /** Texts with fewer characters than this outside "no results" sentences are degenerate */
        private int minContentChars = 50;
    }

    @Data
    public static class Relevance {
        /** Score each abstract against the query before downloading the paper */
        private boolean enabled = true;
        /** Papers scoring below this share of 100 are not analyzed */
        private double minScore = 0.3;
    }

    @Data
    public static class Cache {
        private CacheProvider provider = CacheProvider.REDIS;
        private Duration ttl = Duration.ofDays(30);
        private String keyPrefix = "library-index:analysis:";
    }

    @Data
    public static class Document {
        /** Structured text handed to the analysis model is cut to this many characters */
        private int maxChunkLength = 20000;
        private long maxDownloadBytes = 50L * 1024 * 1024;
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration responseTimeout = Duration.ofSeconds(90);
        private int maxConnections = 64;
    }
}
