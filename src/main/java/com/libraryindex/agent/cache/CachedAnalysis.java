package com.libraryindex.agent.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One cached paper analysis in MongoDB.
 *
 * Collection: paper_analyses. {@code expiresAt} carries a TTL index so Mongo
 * removes stale entries on its own; lookups also check it.
 */
@Document(collection = "paper_analyses")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedAnalysis {

    @Id
    private String paperId;

    private String analysis;

    private Instant storedAt;

    @Indexed(expireAfter = "0s")
    private Instant expiresAt;
}
