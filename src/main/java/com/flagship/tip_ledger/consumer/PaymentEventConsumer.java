package com.flagship.tip_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tip_ledger.attribution.AttributionResult;
import com.flagship.tip_ledger.attribution.AttributionService;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.debt.ChargebackResult;
import com.flagship.tip_ledger.debt.ChargebackService;
import com.flagship.tip_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Feeds payment notifications into the tip engine.
 *
 * PaymentCompleted becomes {@code attributeAndPost}, PaymentChargedBack becomes
 * {@code onChargeback}. Offsets are acknowledged only after the event was
 * handled or recorded as rejected; anything else is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PaymentEventConsumer {

    static final String CONSUMER_GROUP = "tip-ledger-payment-consumer";
    private static final String AGGREGATE_TYPE = "Payment";

    private final IdempotentEventProcessor eventProcessor;
    private final AttributionService attributionService;
    private final ChargebackService chargebackService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.payment-events:payment-events}",
        groupId = "${spring.kafka.consumer.group-id:tip-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
            record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        CorrelationContext.begin(envelope.eventId().toString().substring(0, 8));
        try {
            boolean processed = route(envelope, record.value());
            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, eventId={}, paymentId={}",
                    envelope.eventType(), envelope.eventId(), envelope.paymentId());
            }
        } catch (RuntimeException e) {
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            CorrelationContext.clear();
        }
    }

    private boolean route(EventEnvelope envelope, String rawPayload) {
        return switch (envelope.eventType()) {
            case PaymentCompletedMessage.EVENT_TYPE -> eventProcessor.processEvent(
                envelope.eventId(), envelope.eventType(), AGGREGATE_TYPE, envelope.paymentId(), CONSUMER_GROUP,
                () -> {
                    PaymentCompletedMessage message = deserialize(rawPayload, PaymentCompletedMessage.class);
                    AttributionResult result = attributionService.attributeAndPost(message.toCollection());
                    log.debug("Payment {} attributed as {} (duplicate={})",
                        message.getPaymentId(), result.getTransaction().getId(), result.isDuplicate());
                });
            case PaymentChargedBackMessage.EVENT_TYPE -> eventProcessor.processEvent(
                envelope.eventId(), envelope.eventType(), AGGREGATE_TYPE, envelope.paymentId(), CONSUMER_GROUP,
                () -> {
                    PaymentChargedBackMessage message = deserialize(rawPayload, PaymentChargedBackMessage.class);
                    ChargebackResult result = chargebackService.onChargeback(message.getPaymentId());
                    log.debug("Payment {} charged back: reversed={} debt={} (duplicate={})",
                        message.getPaymentId(), result.reversedCents(), result.debtCents(), result.isDuplicate());
                });
            default -> {
                log.debug("Ignoring event type {}", envelope.eventType());
                eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), AGGREGATE_TYPE,
                    envelope.paymentId(), CONSUMER_GROUP, "Not handled by the tip engine");
                yield false;
            }
        };
    }

    private EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.hasNonNull("eventId") || !node.hasNonNull("paymentId")) {
                return null;
            }
            return new EventEnvelope(
                UUID.fromString(node.get("eventId").asText()),
                node.get("paymentId").asText(),
                node.hasNonNull("eventType") ? node.get("eventType").asText() : "Unknown");
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw TipLedgerException.validation("Malformed %s payload: %s", type.getSimpleName(), e.getOriginalMessage());
        }
    }

    private record EventEnvelope(UUID eventId, String paymentId, String eventType) {
    }
}
