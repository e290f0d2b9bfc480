package com.subscription.billing.messaging;

import com.subscription.billing.domain.PaymentSnapshot;
import com.subscription.billing.persistence.service.LedgerResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes applied transitions, keyed by subscription id so consumers see them in order.
 * Fire-and-forget: a failed send is logged and never affects the ledger.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubscriptionEventProducer {

    private final KafkaTemplate<String, SubscriptionEvent> kafkaTemplate;

    @Value("${billing.kafka.topic.subscription-events:subscription-events}")
    private String topic;

    public void publishTransition(LedgerResult result, PaymentSnapshot payment) {
        if (result == null || !result.isApplied()) {
            return;
        }
        SubscriptionEvent event = SubscriptionEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .subscriptionId(result.getSubscriptionId().toString())
                .userId(result.getUserId())
                .provider(result.getProvider() != null ? result.getProvider().getToken() : null)
                .providerSubscriptionId(result.getProviderSubscriptionId())
                .eventType(result.getEventType() != null ? result.getEventType().getToken() : null)
                .previousStatus(result.getPreviousStatus())
                .newStatus(result.getNewStatus())
                .amountMinor(payment != null ? payment.getAmount() : null)
                .currency(payment != null ? payment.getCurrency() : null)
                .timestamp(Instant.now())
                .build();
        send(event.getSubscriptionId(), event);
    }

    private void send(String key, SubscriptionEvent event) {
        log.info("Publishing subscription event: key={}, eventId={}, eventType={}, newStatus={}",
                key, event.getEventId(), event.getEventType(), event.getNewStatus());
        try {
            CompletableFuture<SendResult<String, SubscriptionEvent>> future = kafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish subscription event key={} eventId={}", key, event.getEventId(), ex);
                } else {
                    log.debug("Published subscription event: key={}, eventId={}, partition={}, offset={}",
                            key, event.getEventId(),
                            result != null ? result.getRecordMetadata().partition() : null,
                            result != null ? result.getRecordMetadata().offset() : null);
                }
            });
        } catch (RuntimeException e) {
            log.error("Kafka send rejected for subscription event key={} eventId={}", key, event.getEventId(), e);
        }
    }
}
