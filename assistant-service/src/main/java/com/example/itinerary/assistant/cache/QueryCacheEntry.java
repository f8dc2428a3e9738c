package com.example.itinerary.assistant.cache;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "ai_query_cache", indexes = @Index(name = "idx_ai_query_cache_trip", columnList = "tripId"))
public class QueryCacheEntry {
    @Id
    @Column(length = 64)
    private String questionHash;

    @Column(nullable = false)
    private String tripId;

    @Column(nullable = false, columnDefinition = "text")
    private String answer;

    @Column(nullable = false)
    private int tokensUsed;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant expiresAt;

    public QueryCacheEntry() {
    }

    public QueryCacheEntry(String questionHash, String tripId, String answer, int tokensUsed,
                           Instant createdAt, Instant expiresAt) {
        this.questionHash = questionHash;
        this.tripId = tripId;
        this.answer = answer;
        this.tokensUsed = tokensUsed;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    public String getQuestionHash() {
        return questionHash;
    }

    public String getTripId() {
        return tripId;
    }

    public String getAnswer() {
        return answer;
    }

    public int getTokensUsed() {
        return tokensUsed;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    @Override
    public String toString() {
        return "QueryCacheEntry{tripId='" + tripId + "', questionHash='" + questionHash + "', expiresAt=" + expiresAt + "}";
    }
}
