package com.flagship.tip_ledger.bank;

import com.flagship.tip_ledger.bank.dto.BankedShareResponse;
import com.flagship.tip_ledger.bank.dto.PayOutRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Banked tip-outs waiting for an off-duty employee.
 */
@RestController
@RequiredArgsConstructor
public class BankController {

    private final BankService bankService;

    @GetMapping("/api/employees/{employeeId}/banked-shares")
    public List<BankedShareResponse> pending(@PathVariable("employeeId") UUID employeeId) {
        return bankService.pendingBankedShares(employeeId).stream().map(BankedShareResponse::from).toList();
    }

    @GetMapping("/api/banked-shares/{id}")
    public BankedShareResponse get(@PathVariable("id") UUID id) {
        return BankedShareResponse.from(bankService.get(id));
    }

    /**
     * Moves the share into the owner's ledger; the owner must be clocked in at {@code at}.
     */
    @PostMapping("/api/banked-shares/{id}/collect")
    public BankedShareResponse collect(
            @PathVariable("id") UUID id,
            @RequestParam(value = "at", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant at) {
        return BankedShareResponse.from(bankService.collect(id, at != null ? at : Instant.now()));
    }

    @PostMapping("/api/banked-shares/{id}/payout")
    public BankedShareResponse payOut(@PathVariable("id") UUID id, @Valid @RequestBody PayOutRequest request) {
        return BankedShareResponse.from(bankService.payOut(id, request.getPayrollRef()));
    }
}
