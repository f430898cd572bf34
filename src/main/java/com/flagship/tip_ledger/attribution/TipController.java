package com.flagship.tip_ledger.attribution;

import com.flagship.tip_ledger.attribution.dto.AttributionResponse;
import com.flagship.tip_ledger.attribution.dto.RecordTipRequest;
import com.flagship.tip_ledger.attribution.dto.TipTransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Synchronous entry point for collected tips, next to the Kafka consumer.
 *
 * The payment id is the idempotency key: resubmitting a payment returns the
 * original attribution with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/tips")
@RequiredArgsConstructor
@Slf4j
public class TipController {

    private final AttributionService attributionService;

    @PostMapping
    public ResponseEntity<AttributionResponse> record(@Valid @RequestBody RecordTipRequest request) {
        log.info("Received tip: paymentId={}, amount={}, employee={}, pool={}, owners={}",
            request.getPaymentId(), request.getAmountCents(), request.getEmployeeId(), request.getPoolId(),
            request.getOwners() == null ? 0 : request.getOwners().size());

        AttributionResult result = attributionService.attributeAndPost(request.toCollection());
        return ResponseEntity.status(result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(AttributionResponse.from(result));
    }

    @GetMapping("/payments/{paymentId}")
    public AttributionResponse byPayment(@PathVariable("paymentId") String paymentId) {
        return AttributionResponse.from(attributionService.existingResult(paymentId));
    }

    @GetMapping("/{id}")
    public TipTransactionResponse get(@PathVariable("id") UUID id) {
        return TipTransactionResponse.from(attributionService.getTransaction(id));
    }
}
