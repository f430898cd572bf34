package com.flagship.tip_ledger.ledger;

import com.flagship.tip_ledger.ledger.dto.AdjustmentRequest;
import com.flagship.tip_ledger.ledger.dto.BalanceResponse;
import com.flagship.tip_ledger.ledger.dto.LedgerEntryResponse;
import com.flagship.tip_ledger.ledger.dto.PostingResponse;
import com.flagship.tip_ledger.ledger.dto.ReversalRequest;
import com.flagship.tip_ledger.ledger.dto.TransferRequest;
import com.flagship.tip_ledger.ledger.dto.TransferResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.StreamSupport;

/**
 * Balances, statements and manager corrections.
 *
 * Adjustments and transfers require an Idempotency-Key header; repeating a
 * request with the same key returns the original entries with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final LedgerService ledgerService;

    @GetMapping("/employees/{employeeId}/balance")
    public BalanceResponse balance(@PathVariable("employeeId") UUID employeeId) {
        return BalanceResponse.from(ledgerService.accountOf(employeeId));
    }

    @GetMapping("/employees/{employeeId}/entries")
    public List<LedgerEntryResponse> history(
            @PathVariable("employeeId") UUID employeeId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        LedgerHistory history = ledgerService.history(employeeId, from, to);
        return StreamSupport.stream(history.spliterator(), false)
            .map(LedgerEntryResponse::from)
            .toList();
    }

    @PostMapping("/employees/{employeeId}/adjustments")
    public ResponseEntity<PostingResponse> adjust(
            @PathVariable("employeeId") UUID employeeId,
            @Valid @RequestBody AdjustmentRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {
        log.info("Adjustment requested: employee={}, amount={}, idempotencyKey={}",
            employeeId, request.getAmountCents(), idempotencyKey);
        PostingResult result = ledgerService.adjust(employeeId, request.getAmountCents(), request.getMemo(),
            idempotencyKey);
        return ResponseEntity.status(result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(PostingResponse.from(result));
    }

    @PostMapping("/transfers")
    public ResponseEntity<TransferResponse> transfer(
            @Valid @RequestBody TransferRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {
        log.info("Transfer requested: {} -> {}, amount={}, idempotencyKey={}",
            request.getFromEmployeeId(), request.getToEmployeeId(), request.getAmountCents(), idempotencyKey);
        TransferResult result = ledgerService.transfer(request.getFromEmployeeId(), request.getToEmployeeId(),
            request.getAmountCents(), request.getMemo(), idempotencyKey);
        return ResponseEntity.status(result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(TransferResponse.from(result));
    }

    @GetMapping("/entries/{entryId}")
    public LedgerEntryResponse entry(@PathVariable("entryId") UUID entryId) {
        return LedgerEntryResponse.from(ledgerService.findEntry(entryId));
    }

    @PostMapping("/entries/{entryId}/reversal")
    public ResponseEntity<PostingResponse> reverse(@PathVariable("entryId") UUID entryId,
                                                   @RequestBody(required = false) ReversalRequest request) {
        String memo = request != null && request.getMemo() != null ? request.getMemo() : "Reversal of " + entryId;
        PostingResult result = ledgerService.reverse(entryId, memo);
        return ResponseEntity.status(result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(PostingResponse.from(result));
    }

    /**
     * Recomputes an account's balance from its entries; fails with INTEGRITY_VIOLATION when it drifted.
     */
    @GetMapping("/accounts/{accountId}/verify")
    public Map<String, Object> verify(@PathVariable("accountId") UUID accountId) {
        long balance = ledgerService.verifyBalance(accountId);
        return Map.of("account_id", accountId, "balance_cents", balance, "consistent", true);
    }
}
