package com.libraryindex.agent.cache;

import com.libraryindex.agent.config.ResearchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the analysis cache backend from {@code research.cache.provider}.
 */
@Configuration
@Slf4j
public class AnalysisCacheConfig {

    @Bean
    public AnalysisCache analysisCache(ResearchProperties properties,
                                       ObjectProvider<StringRedisTemplate> redisTemplate,
                                       ObjectProvider<MongoTemplate> mongoTemplate) {
        ResearchProperties.Cache cache = properties.getCache();
        AnalysisCache selected = switch (cache.getProvider()) {
            case REDIS -> new RedisAnalysisCache(redisTemplate.getObject(), cache.getKeyPrefix(), cache.getTtl());
            case MONGO -> new MongoAnalysisCache(mongoTemplate.getObject(), cache.getTtl());
        };
        log.info("Analysis cache: {} (TTL {})", selected.describe(), cache.getTtl());
        return selected;
    }
}
