package com.flagship.solid_ledger.api;

import com.flagship.solid_ledger.api.dto.AllowanceResponse;
import com.flagship.solid_ledger.api.dto.AmountOutResponse;
import com.flagship.solid_ledger.api.dto.ApproveRequest;
import com.flagship.solid_ledger.api.dto.BalanceResponse;
import com.flagship.solid_ledger.api.dto.OperationResponse;
import com.flagship.solid_ledger.api.dto.ReservesResponse;
import com.flagship.solid_ledger.api.dto.RetrieveRequest;
import com.flagship.solid_ledger.api.dto.SolidValueResponse;
import com.flagship.solid_ledger.api.dto.SupplyResponse;
import com.flagship.solid_ledger.api.dto.TokenInfoResponse;
import com.flagship.solid_ledger.api.dto.TransferFromRequest;
import com.flagship.solid_ledger.api.dto.TransferRequest;
import com.flagship.solid_ledger.api.dto.ValueRequest;
import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.chain.Chain;
import com.flagship.solid_ledger.chain.Receipt;
import com.flagship.solid_ledger.observability.CorrelationIdFilter;
import com.flagship.solid_ledger.observability.TokenMetrics;
import com.flagship.solid_ledger.token.SolidValueToken;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * REST controller for the solid value token.
 *
 * Every mutating call names its caller in the X-Caller-Address header and runs as
 * one atomic ledger operation: it either commits with its events or leaves no trace.
 * Rejections surface as {@link com.flagship.solid_ledger.token.LedgerException}
 * and are mapped to HTTP statuses by the global exception handler.
 */
@RestController
@RequestMapping("/api/token")
@RequiredArgsConstructor
@Slf4j
public class TokenController {

    private final SolidValueToken token;
    private final Chain chain;
    private final TokenMetrics tokenMetrics;

    // ==================== Views ====================

    @GetMapping
    public ResponseEntity<TokenInfoResponse> getToken() {
        return ResponseEntity.ok(TokenInfoResponse.from(token));
    }

    @GetMapping("/balances/{account}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("account") Address account) {
        return ResponseEntity.ok(new BalanceResponse(account, token.balanceOf(account)));
    }

    @GetMapping("/allowances/{owner}/{spender}")
    public ResponseEntity<AllowanceResponse> getAllowance(@PathVariable("owner") Address owner,
                                                          @PathVariable("spender") Address spender) {
        return ResponseEntity.ok(new AllowanceResponse(owner, spender, token.allowance(owner, spender)));
    }

    @GetMapping("/supply")
    public ResponseEntity<SupplyResponse> getSupply() {
        return ResponseEntity.ok(new SupplyResponse(token.totalSupply()));
    }

    /**
     * The per-unit value is omitted while nothing is in circulation.
     */
    @GetMapping("/solid-value")
    public ResponseEntity<SolidValueResponse> getSolidValue() {
        BigInteger supply = token.totalSupply();
        BigInteger perUnit = supply.signum() == 0 ? null : token.solidValuePerUnit();
        return ResponseEntity.ok(new SolidValueResponse(token.solidValue(), supply, perUnit));
    }

    @GetMapping("/reserves")
    public ResponseEntity<ReservesResponse> getReserves() {
        return ResponseEntity.ok(ReservesResponse.from(token.getReserves()));
    }

    @GetMapping("/amount-out")
    public ResponseEntity<AmountOutResponse> getAmountOut(@RequestParam("value") BigInteger value,
                                                          @RequestParam(name = "buy", defaultValue = "true") boolean buy) {
        return ResponseEntity.ok(new AmountOutResponse(value, buy, token.getAmountOut(value, buy)));
    }

    // ==================== Mutations ====================

    /**
     * Transfers units. A transfer to the token's own address sells them to the pool.
     */
    @PostMapping("/transfer")
    public ResponseEntity<OperationResponse> transfer(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) Address caller,
            @Valid @RequestBody TransferRequest request) {

        log.info("Transfer requested: to={}, amount={}", request.getTo(), request.getAmount());
        Receipt<Boolean> receipt = tokenMetrics.time("transfer",
                () -> chain.submit(() -> token.transfer(caller, request.getTo(), request.getAmount())));
        log.info("Transfer committed: to={}, amount={}, block={}", request.getTo(), request.getAmount(), receipt.getBlock());

        return ResponseEntity.ok(OperationResponse.ok("transfer", receipt.getBlock()));
    }

    @PostMapping("/approve")
    public ResponseEntity<OperationResponse> approve(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) Address caller,
            @Valid @RequestBody ApproveRequest request) {

        Receipt<Boolean> receipt = tokenMetrics.time("approve",
                () -> chain.submit(() -> token.approve(caller, request.getSpender(), request.getAmount())));
        log.info("Approval committed: spender={}, amount={}", request.getSpender(), request.getAmount());

        return ResponseEntity.ok(OperationResponse.ok("approve", receipt.getBlock()));
    }

    @PostMapping("/transfer-from")
    public ResponseEntity<OperationResponse> transferFrom(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) Address caller,
            @Valid @RequestBody TransferFromRequest request) {

        log.info("Delegated transfer requested: from={}, to={}, amount={}",
                request.getFrom(), request.getTo(), request.getAmount());
        Receipt<Boolean> receipt = tokenMetrics.time("transferFrom", () -> chain.submit(
                () -> token.transferFrom(caller, request.getFrom(), request.getTo(), request.getAmount())));

        return ResponseEntity.ok(OperationResponse.ok("transfer-from", receipt.getBlock()));
    }

    /**
     * Donates currency to the reserve, raising the value of every unit.
     */
    @PostMapping("/enhance")
    public ResponseEntity<OperationResponse> enhance(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) Address caller,
            @Valid @RequestBody ValueRequest request) {

        Receipt<Void> receipt = tokenMetrics.time("enhance", () -> chain.submit(() -> {
            token.enhanceTokenValue(caller, request.getValue());
            return null;
        }));
        log.info("Token value enhanced: value={}, reserve={}", request.getValue(), token.solidValue());

        return ResponseEntity.ok(OperationResponse.ok("enhance", request.getValue(), receipt.getBlock()));
    }

    /**
     * Burns units and pays out their share of the reserve.
     */
    @PostMapping("/retrieve")
    public ResponseEntity<OperationResponse> retrieve(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) Address caller,
            @Valid @RequestBody RetrieveRequest request) {

        Receipt<BigInteger> receipt = tokenMetrics.time("retrieve",
                () -> chain.submit(() -> token.retrieveTokenValue(caller, request.getAmount())));
        log.info("Token value retrieved: burned={}, payout={}", request.getAmount(), receipt.getResult());

        return ResponseEntity.ok(OperationResponse.ok("retrieve", receipt.getResult(), receipt.getBlock()));
    }

    /**
     * Buys units from the pool with the attached currency.
     */
    @PostMapping("/buy")
    public ResponseEntity<OperationResponse> buy(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) Address caller,
            @Valid @RequestBody ValueRequest request) {

        Receipt<BigInteger> receipt = tokenMetrics.time("buy",
                () -> chain.submit(() -> token.buy(caller, request.getValue())));
        log.info("Buy committed: value={}, unitsOut={}", request.getValue(), receipt.getResult());

        return ResponseEntity.ok(OperationResponse.ok("buy", receipt.getResult(), receipt.getBlock()));
    }
}
