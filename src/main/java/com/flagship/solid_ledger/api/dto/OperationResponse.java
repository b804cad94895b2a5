package com.flagship.solid_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a committed mutating call.
 *
 * {@code amount} carries the operation's result where it has one: units bought,
 * currency paid out on retrieval, liquidity removed.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationResponse {

    @JsonProperty("operation")
    String operation;

    @JsonProperty("success")
    boolean success;

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("block")
    long block;

    public static OperationResponse ok(String operation, long block) {
        return OperationResponse.builder().operation(operation).success(true).block(block).build();
    }

    public static OperationResponse ok(String operation, BigInteger amount, long block) {
        return OperationResponse.builder().operation(operation).success(true).amount(amount).block(block).build();
    }
}
