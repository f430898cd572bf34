package com.flagship.tip_ledger.outbox;

import com.flagship.tip_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Relays committed tip events from the outbox to the tip events topic.
 *
 * Sends are synchronous and keyed by aggregate id, so events of one tip
 * transaction, debt or banked share stay ordered on one partition.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.tip-events:tip-events}")
    private String tipEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            OutboxService.RelayOutcome outcome = outboxService.relayBatch(batchSize, maxRetries, this::send);
            if (outcome.sent() > 0 || outcome.failed() > 0) {
                log.debug("Outbox relay: sent={}, failed={}", outcome.sent(), outcome.failed());
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void send(OutboxEvent event) throws Exception {
        try {
            SendResult<String, String> result = kafkaTemplate
                .send(tipEventsTopic, event.getAggregateId().toString(), event.getPayload())
                .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}",
                event.getId(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());
            outboxMetrics.recordEventPublished(event.getEventType());
        } catch (Exception e) {
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
            throw e;
        }
    }
}
