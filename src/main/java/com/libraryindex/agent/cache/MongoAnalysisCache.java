package com.libraryindex.agent.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * MongoDB-backed analysis cache: one document per paper id, written by upsert
 * so concurrent analyzers of the same paper never create duplicates.
 */
@Slf4j
public class MongoAnalysisCache implements AnalysisCache {

    private final MongoTemplate mongoTemplate;
    private final Duration ttl;

    public MongoAnalysisCache(MongoTemplate mongoTemplate, Duration ttl) {
        this.mongoTemplate = mongoTemplate;
        this.ttl = ttl;
    }

    @Override
    public Optional<String> lookup(String paperId) {
        try {
            CachedAnalysis cached = mongoTemplate.findById(paperId, CachedAnalysis.class);
            if (cached == null || cached.getAnalysis() == null || cached.getAnalysis().isBlank()) {
                return Optional.empty();
            }
            if (cached.getExpiresAt() != null && cached.getExpiresAt().isBefore(Instant.now())) {
                return Optional.empty();
            }
            log.debug("Analysis cache hit: {}", paperId);
            return Optional.of(cached.getAnalysis());
        } catch (RuntimeException e) {
            log.warn("Analysis cache read failed for {}: {}", paperId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void store(String paperId, String analysis) {
        Instant now = Instant.now();
        Update update = new Update()
                .set("analysis", analysis)
                .set("storedAt", now)
                .set("expiresAt", now.plus(ttl));
        try {
            mongoTemplate.upsert(byId(paperId), update, CachedAnalysis.class);
            log.debug("Analysis cached: {}", paperId);
        } catch (RuntimeException e) {
            log.warn("Analysis cache write failed for {}: {}", paperId, e.getMessage());
        }
    }

    @Override
    public boolean healthCheck() {
        String healthId = "__health__:" + UUID.randomUUID();
        try {
            mongoTemplate.save(CachedAnalysis.builder()
                    .paperId(healthId)
                    .analysis("ok")
                    .storedAt(Instant.now())
                    .expiresAt(Instant.now().plusSeconds(30))
                    .build());
            CachedAnalysis read = mongoTemplate.findById(healthId, CachedAnalysis.class);
            mongoTemplate.remove(byId(healthId), CachedAnalysis.class);
            return read != null && "ok".equals(read.getAnalysis());
        } catch (RuntimeException e) {
            log.error("Mongo analysis cache health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String describe() {
        return "mongo(paper_analyses)";
    }

    private static Query byId(String paperId) {
        return Query.query(Criteria.where("_id").is(paperId));
    }
}
