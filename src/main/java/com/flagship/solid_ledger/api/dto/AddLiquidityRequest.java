package com.flagship.solid_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigInteger;

/**
 * Request DTO for locking liquidity.
 */
@Value
public class AddLiquidityRequest {

    @NotNull(message = "Value is required")
    @PositiveOrZero(message = "Value must not be negative")
    @JsonProperty("value")
    BigInteger value;

    @NotNull(message = "Unlock block is required")
    @JsonProperty("unlock_block")
    Long unlockBlock;
}
