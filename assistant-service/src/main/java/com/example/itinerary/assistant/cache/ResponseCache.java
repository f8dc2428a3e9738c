package com.example.itinerary.assistant.cache;

import com.example.itinerary.assistant.config.QueryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

/**
 * Answers keyed by trip and normalized question text. Storage failures never reach the caller:
 * a failed read is a miss, a failed write is dropped.
 */
@Service
public class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final QueryCacheRepository repository;
    private final Clock clock;
    private final Duration ttl;

    public ResponseCache(QueryCacheRepository repository, Clock clock, QueryProperties props) {
        this.repository = repository;
        this.clock = clock;
        this.ttl = props.getCacheTtl();
    }

    public static String key(String tripId, String question) {
        String material = tripId + ":" + question.trim().toLowerCase(Locale.ROOT);
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public Optional<QueryCacheEntry> get(String tripId, String question) {
        String key = key(tripId, question);
        try {
            Optional<QueryCacheEntry> found = repository.findById(key);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            if (found.get().isExpiredAt(clock.instant())) {
                log.debug("[ResponseCache] Entry {} expired at {}; deleting", key, found.get().getExpiresAt());
                repository.deleteById(key);
                return Optional.empty();
            }
            return found;
        } catch (Exception ex) {
            log.warn("[ResponseCache] Cache read failed for trip {}: {}", tripId, ex.toString());
            return Optional.empty();
        }
    }

    public void put(String tripId, String question, String answer, int tokensUsed) {
        try {
            Instant now = clock.instant();
            repository.save(new QueryCacheEntry(key(tripId, question), tripId, answer, tokensUsed, now, now.plus(ttl)));
        } catch (Exception ex) {
            log.warn("[ResponseCache] Cache write failed for trip {}: {}", tripId, ex.toString());
        }
    }
}
