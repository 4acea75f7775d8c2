package com.libraryindex.agent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libraryindex.agent.search.AcademicSearchClient;
import com.libraryindex.agent.search.ArxivQueryGenerator;
import com.libraryindex.agent.search.ArxivSearchClient;
import com.libraryindex.agent.search.SearchRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Selects the academic search provider from {@code research.search.provider}.
 */
@Configuration
@Slf4j
public class SearchClientConfig {

    @Bean
    public AcademicSearchClient academicSearchClient(ResearchProperties properties,
                                                     RestClient.Builder restClientBuilder) {
        log.info("Academic search provider: {}", properties.getSearch().getProvider());
        return switch (properties.getSearch().getProvider()) {
            case ARXIV -> new ArxivSearchClient(properties, restClientBuilder.clone());
        };
    }

    @Bean
    public ArxivQueryGenerator arxivQueryGenerator(ObjectMapper objectMapper) {
        return new ArxivQueryGenerator(objectMapper);
    }

    /** One limiter per process: the provider's limit is per client, not per session. */
    @Bean
    public SearchRateLimiter searchRateLimiter(ResearchProperties properties) {
        return new SearchRateLimiter(properties.getSearch().getMinInterval());
    }
}
