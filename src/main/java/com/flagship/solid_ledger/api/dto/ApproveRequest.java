package com.flagship.solid_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.solid_ledger.chain.Address;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigInteger;

/**
 * Request DTO for setting an allowance.
 */
@Value
public class ApproveRequest {

    @NotNull(message = "Spender is required")
    @JsonProperty("spender")
    Address spender;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    @JsonProperty("amount")
    BigInteger amount;
}
