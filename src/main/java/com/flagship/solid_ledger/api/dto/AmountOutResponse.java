package com.flagship.solid_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

/**
 * Swap quote against the current pool.
 */
@Value
public class AmountOutResponse {

    @JsonProperty("value")
    BigInteger value;

    @JsonProperty("buy")
    boolean buy;

    @JsonProperty("amount_out")
    BigInteger amountOut;
}
