package com.flagship.tip_ledger.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class WriteOffRequest {

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;

    @NotBlank(message = "Approver is required")
    @JsonProperty("written_off_by")
    String writtenOffBy;
}
