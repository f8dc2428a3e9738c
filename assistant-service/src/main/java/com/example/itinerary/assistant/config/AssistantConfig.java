package com.example.itinerary.assistant.config;

import com.example.itinerary.common.normalize.EventNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class AssistantConfig {

    @Bean
    public WebClient tripStoreWebClient(TripStoreProperties props) {
        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .build();
    }

    @Bean
    public EventNormalizer eventNormalizer(ObjectMapper objectMapper) {
        return new EventNormalizer(objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
