package com.flagship.solid_ledger.api;

import com.flagship.solid_ledger.api.dto.AddLiquidityRequest;
import com.flagship.solid_ledger.api.dto.ExtendLockRequest;
import com.flagship.solid_ledger.api.dto.LiquidityResponse;
import com.flagship.solid_ledger.api.dto.OperationResponse;
import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.chain.Chain;
import com.flagship.solid_ledger.chain.Receipt;
import com.flagship.solid_ledger.liquidity.LiquidityLock;
import com.flagship.solid_ledger.observability.CorrelationIdFilter;
import com.flagship.solid_ledger.observability.TokenMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * REST controller for the owner-only liquidity lock.
 */
@RestController
@RequestMapping("/api/liquidity")
@RequiredArgsConstructor
@Slf4j
public class LiquidityController {

    private final LiquidityLock lock;
    private final Chain chain;
    private final TokenMetrics tokenMetrics;

    @GetMapping
    public ResponseEntity<LiquidityResponse> getLock() {
        return ResponseEntity.ok(LiquidityResponse.from(lock));
    }

    @PostMapping("/add")
    public ResponseEntity<OperationResponse> add(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) Address caller,
            @Valid @RequestBody AddLiquidityRequest request) {

        Receipt<Void> receipt = tokenMetrics.time("addLiquidity", () -> chain.submit(() -> {
            lock.addLiquidity(caller, request.getValue(), request.getUnlockBlock());
            return null;
        }));

        return ResponseEntity.ok(OperationResponse.ok("add-liquidity", request.getValue(), receipt.getBlock()));
    }

    @PostMapping("/extend")
    public ResponseEntity<OperationResponse> extend(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) Address caller,
            @Valid @RequestBody ExtendLockRequest request) {

        Receipt<Void> receipt = tokenMetrics.time("extendLiquidityLock", () -> chain.submit(() -> {
            lock.extendLiquidityLock(caller, request.getUnlockBlock());
            return null;
        }));

        return ResponseEntity.ok(OperationResponse.ok("extend-liquidity-lock", receipt.getBlock()));
    }

    @PostMapping("/remove")
    public ResponseEntity<OperationResponse> remove(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) Address caller) {

        Receipt<BigInteger> receipt = tokenMetrics.time("removeLiquidity",
                () -> chain.submit(() -> lock.removeLiquidity(caller)));

        return ResponseEntity.ok(OperationResponse.ok("remove-liquidity", receipt.getResult(), receipt.getBlock()));
    }
}
