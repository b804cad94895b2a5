package com.flagship.solid_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.solid_ledger.chain.Address;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigInteger;

/**
 * Request DTO for a plain currency send; the recipient's hook runs.
 */
@Value
public class SendCurrencyRequest {

    @NotNull(message = "Recipient is required")
    @JsonProperty("to")
    Address to;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    @JsonProperty("amount")
    BigInteger amount;
}
