package com.flagship.solid_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

/**
 * Reserve backing the supply. The per-unit value is absent while the supply is zero.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SolidValueResponse {

    @JsonProperty("solid_value")
    BigInteger solidValue;

    @JsonProperty("total_supply")
    BigInteger totalSupply;

    @JsonProperty("solid_value_per_unit")
    BigInteger solidValuePerUnit;
}
