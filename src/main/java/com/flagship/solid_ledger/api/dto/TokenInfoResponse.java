package com.flagship.solid_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.token.SolidValueToken;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Token metadata and headline figures.
 */
@Value
@Builder
public class TokenInfoResponse {

    @JsonProperty("address")
    Address address;

    @JsonProperty("name")
    String name;

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("decimals")
    int decimals;

    @JsonProperty("total_supply")
    BigInteger totalSupply;

    @JsonProperty("solid_value")
    BigInteger solidValue;

    @JsonProperty("reserve_keeper")
    Address reserveKeeper;

    public static TokenInfoResponse from(SolidValueToken token) {
        return TokenInfoResponse.builder()
            .address(token.getAddress())
            .name(token.name())
            .symbol(token.symbol())
            .decimals(token.decimals())
            .totalSupply(token.totalSupply())
            .solidValue(token.solidValue())
            .reserveKeeper(token.getReserveKeeper().getAddress())
            .build();
    }
}
