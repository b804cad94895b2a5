package com.flagship.solid_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.solid_ledger.chain.Address;
import lombok.Value;

import java.math.BigInteger;

@Value
public class AllowanceResponse {

    @JsonProperty("owner")
    Address owner;

    @JsonProperty("spender")
    Address spender;

    @JsonProperty("allowance")
    BigInteger allowance;
}
