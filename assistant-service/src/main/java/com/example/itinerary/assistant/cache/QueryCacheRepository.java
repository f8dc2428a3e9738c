package com.example.itinerary.assistant.cache;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface QueryCacheRepository extends JpaRepository<QueryCacheEntry, String> {

    List<QueryCacheEntry> findByTripId(String tripId);
}
