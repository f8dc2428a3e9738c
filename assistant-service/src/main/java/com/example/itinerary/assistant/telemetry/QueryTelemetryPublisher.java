package com.example.itinerary.assistant.telemetry;

import com.example.itinerary.assistant.config.TelemetryProperties;
import com.example.itinerary.common.Topics;
import com.example.itinerary.common.events.QueryTelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget publication of per-question telemetry. Failures are logged and never propagated.
 */
@Service
public class QueryTelemetryPublisher {

    private static final Logger log = LoggerFactory.getLogger(QueryTelemetryPublisher.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final TelemetryProperties props;

    public QueryTelemetryPublisher(KafkaTemplate<String, Object> kafkaTemplate, TelemetryProperties props) {
        this.kafkaTemplate = kafkaTemplate;
        this.props = props;
    }

    public void publish(QueryTelemetryEvent event) {
        if (!props.isEnabled()) {
            return;
        }
        try {
            kafkaTemplate.send(Topics.QUERY_TELEMETRY, event.getTripId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("[QueryTelemetryPublisher] Telemetry send failed for trip {}: {}",
                                    event.getTripId(), ex.toString());
                        }
                    });
        } catch (Exception ex) {
            log.warn("[QueryTelemetryPublisher] Telemetry send failed for trip {}: {}", event.getTripId(), ex.toString());
        }
    }
}
