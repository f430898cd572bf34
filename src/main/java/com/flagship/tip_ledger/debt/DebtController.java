package com.flagship.tip_ledger.debt;

import com.flagship.tip_ledger.debt.dto.ChargebackResponse;
import com.flagship.tip_ledger.debt.dto.TipDebtResponse;
import com.flagship.tip_ledger.debt.dto.WriteOffRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Chargebacks and the debts they leave behind.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class DebtController {

    private final DebtService debtService;
    private final ChargebackService chargebackService;

    @PostMapping("/api/tips/payments/{paymentId}/chargeback")
    public ResponseEntity<ChargebackResponse> chargeback(@PathVariable("paymentId") String paymentId) {
        log.info("Chargeback requested for payment {}", paymentId);
        ChargebackResult result = chargebackService.onChargeback(paymentId);
        return ResponseEntity.status(result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(ChargebackResponse.from(result));
    }

    @GetMapping("/api/employees/{employeeId}/debts")
    public List<TipDebtResponse> debtsOf(@PathVariable("employeeId") UUID employeeId,
                                         @RequestParam(value = "openOnly", defaultValue = "false") boolean openOnly) {
        List<TipDebt> debts = openOnly ? debtService.openDebts(employeeId) : debtService.debtsOf(employeeId);
        return debts.stream().map(TipDebtResponse::from).toList();
    }

    @GetMapping("/api/debts/{debtId}")
    public TipDebtResponse get(@PathVariable("debtId") UUID debtId) {
        return TipDebtResponse.from(debtService.get(debtId));
    }

    @PostMapping("/api/debts/{debtId}/write-off")
    public TipDebtResponse writeOff(@PathVariable("debtId") UUID debtId, @Valid @RequestBody WriteOffRequest request) {
        return TipDebtResponse.from(debtService.writeOff(debtId, request.getReason(), request.getWrittenOffBy()));
    }
}
