package com.flagship.solid_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.solid_ledger.chain.Address;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigInteger;

/**
 * Request DTO for delegated transfers.
 */
@Value
public class TransferFromRequest {

    @NotNull(message = "Owner is required")
    @JsonProperty("from")
    Address from;

    @NotNull(message = "Recipient is required")
    @JsonProperty("to")
    Address to;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    @JsonProperty("amount")
    BigInteger amount;
}
