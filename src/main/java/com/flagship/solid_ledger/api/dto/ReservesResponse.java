package com.flagship.solid_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.solid_ledger.token.Reserves;
import lombok.Value;

import java.math.BigInteger;

/**
 * Both sides of the swap pool.
 */
@Value
public class ReservesResponse {

    @JsonProperty("currency")
    BigInteger currency;

    @JsonProperty("units")
    BigInteger units;

    public static ReservesResponse from(Reserves reserves) {
        return new ReservesResponse(reserves.getCurrency(), reserves.getUnits());
    }
}
