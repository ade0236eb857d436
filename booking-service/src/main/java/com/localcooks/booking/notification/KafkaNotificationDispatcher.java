package com.localcooks.booking.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes {@link BookingDecidedEvent} to Kafka, keyed by booking id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaNotificationDispatcher implements NotificationDispatcher {

    static final String TOPIC_BOOKING_DECIDED = "booking-decided";

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public void notify(Long chefId, Long bookingId, DecisionSummary summary) {
        BookingDecidedEvent event = BookingDecidedEvent.builder()
                .bookingId(bookingId)
                .chefId(chefId)
                .kitchenOutcome(summary.kitchenOutcome())
                .storageOutcomes(summary.storageOutcomes())
                .capturedCents(summary.capturedCents())
                .releasedCents(summary.releasedCents())
                .summary(summary.message())
                .reason(summary.reason())
                .timestamp(Instant.now())
                .build();

        log.info("Publishing event to topic {}: {}", TOPIC_BOOKING_DECIDED, event);
        CompletableFuture<SendResult<String, Object>> future;
        try {
            future = kafkaTemplate.send(TOPIC_BOOKING_DECIDED, String.valueOf(bookingId), event);
        } catch (Exception e) {
            log.warn("Failed to hand booking {} decision event to Kafka (chef {} not notified)", bookingId, chefId, e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published successfully to topic {}: offset={}",
                        TOPIC_BOOKING_DECIDED, result.getRecordMetadata().offset());
            } else {
                log.warn("Failed to publish booking {} decision event to topic {}", bookingId, TOPIC_BOOKING_DECIDED, ex);
            }
        });
    }
}
