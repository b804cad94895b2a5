package com.flagship.solid_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.liquidity.LiquidityLock;
import com.flagship.solid_ledger.liquidity.LockState;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class LiquidityResponse {

    @JsonProperty("address")
    Address address;

    @JsonProperty("owner")
    Address owner;

    @JsonProperty("state")
    LockState state;

    @JsonProperty("unlock_block")
    long unlockBlock;

    @JsonProperty("locked_amount")
    BigInteger lockedAmount;

    @JsonProperty("balance")
    BigInteger balance;

    public static LiquidityResponse from(LiquidityLock lock) {
        return LiquidityResponse.builder()
            .address(lock.getAddress())
            .owner(lock.getOwner())
            .state(lock.getState())
            .unlockBlock(lock.getUnlockBlock())
            .lockedAmount(lock.getLockedAmount())
            .balance(lock.getBalance())
            .build();
    }
}
