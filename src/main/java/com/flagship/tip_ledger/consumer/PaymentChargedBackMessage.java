package com.flagship.tip_ledger.consumer;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class PaymentChargedBackMessage {
    public static final String EVENT_TYPE = "PaymentChargedBack";

    UUID eventId;
    String eventType;
    String paymentId;
    Instant occurredAt;
}
