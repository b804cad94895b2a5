package com.flagship.solid_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.solid_ledger.chain.Address;
import lombok.Value;

import java.math.BigInteger;

/**
 * Unit or currency balance of one account.
 */
@Value
public class BalanceResponse {

    @JsonProperty("account")
    Address account;

    @JsonProperty("balance")
    BigInteger balance;
}
