package com.flagship.tip_ledger.attribution.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tip_ledger.attribution.AttributionResult;
import com.flagship.tip_ledger.bank.BankedShare;
import com.flagship.tip_ledger.tipout.TipOutApplication;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Value
@Builder
public class AttributionResponse {

    @JsonProperty("transaction")
    TipTransactionResponse transaction;

    @JsonProperty("shares")
    List<Share> shares;

    @JsonProperty("credit_entry_ids")
    List<UUID> creditEntryIds;

    @JsonProperty("recovered_cents")
    long recoveredCents;

    @JsonProperty("tip_outs")
    List<TipOut> tipOuts;

    @JsonProperty("duplicate")
    boolean duplicate;

    public static AttributionResponse from(AttributionResult result) {
        return AttributionResponse.builder()
            .transaction(TipTransactionResponse.from(result.getTransaction()))
            .shares(result.getShares().stream()
                .map(share -> new Share(share.getEmployeeId(), share.getShareCents()))
                .toList())
            .creditEntryIds(result.getCredits().stream().map(entry -> entry.getId()).toList())
            .recoveredCents(-result.getDebtRecoveries().stream().mapToLong(entry -> entry.getAmountCents()).sum())
            .tipOuts(result.getTipOuts().stream().map(TipOut::from).toList())
            .duplicate(result.isDuplicate())
            .build();
    }

    @Value
    public static class Share {
        @JsonProperty("employee_id")
        UUID employeeId;

        @JsonProperty("share_cents")
        long shareCents;
    }

    @Value
    public static class TipOut {
        @JsonProperty("rule_id")
        UUID ruleId;

        @JsonProperty("from_employee_id")
        UUID fromEmployeeId;

        @JsonProperty("to_role")
        String toRole;

        @JsonProperty("amount_cents")
        long amountCents;

        @JsonProperty("credited")
        Map<UUID, Long> credited;

        @JsonProperty("banked_share_ids")
        List<UUID> bankedShareIds;

        static TipOut from(TipOutApplication application) {
            Map<UUID, Long> credited = application.getCredited().stream()
                .collect(Collectors.toMap(share -> share.getEmployeeId(), share -> share.getShareCents(),
                    Long::sum, LinkedHashMap::new));
            return new TipOut(application.getRuleId(), application.getFromEmployeeId(), application.getToRole(),
                application.getAmountCents(), credited,
                application.getBanked().stream().map(BankedShare::getId).toList());
        }
    }
}
