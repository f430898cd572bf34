package com.flagship.tip_ledger.tipout;

import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.tipout.dto.TipOutRuleRequest;
import com.flagship.tip_ledger.tipout.dto.TipOutRuleResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tip-out-rules")
@RequiredArgsConstructor
public class TipOutRuleController {

    private final TipOutRuleService ruleService;

    @PostMapping
    public ResponseEntity<TipOutRuleResponse> create(@Valid @RequestBody TipOutRuleRequest request) {
        if (request.getLocationId() == null || request.getFromRole() == null || request.getToRole() == null) {
            throw TipLedgerException.validation("location_id, from_role and to_role are required");
        }
        TipOutRule rule = ruleService.create(request.getLocationId(), request.getFromRole(), request.getToRole(),
            request.getPercentage(), request.getMaxPercentage(), request.getBasisType(),
            request.getEffectiveFrom(), request.getExpiresAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(TipOutRuleResponse.from(rule));
    }

    @PutMapping("/{ruleId}")
    public TipOutRuleResponse update(@PathVariable("ruleId") UUID ruleId,
                                     @Valid @RequestBody TipOutRuleRequest request) {
        return TipOutRuleResponse.from(ruleService.update(ruleId, request.getPercentage(),
            request.getMaxPercentage(), request.getBasisType(), request.getEffectiveFrom(), request.getExpiresAt()));
    }

    @PostMapping("/{ruleId}/activate")
    public TipOutRuleResponse activate(@PathVariable("ruleId") UUID ruleId) {
        return TipOutRuleResponse.from(ruleService.setActive(ruleId, true));
    }

    @PostMapping("/{ruleId}/deactivate")
    public TipOutRuleResponse deactivate(@PathVariable("ruleId") UUID ruleId) {
        return TipOutRuleResponse.from(ruleService.setActive(ruleId, false));
    }

    @GetMapping("/{ruleId}")
    public TipOutRuleResponse get(@PathVariable("ruleId") UUID ruleId) {
        return TipOutRuleResponse.from(ruleService.get(ruleId));
    }

    @GetMapping
    public List<TipOutRuleResponse> atLocation(@RequestParam("locationId") UUID locationId) {
        return ruleService.rulesAt(locationId).stream().map(TipOutRuleResponse::from).toList();
    }
}
