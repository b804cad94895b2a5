package com.flagship.solid_ledger.api;

import com.flagship.solid_ledger.api.dto.BalanceResponse;
import com.flagship.solid_ledger.api.dto.OperationResponse;
import com.flagship.solid_ledger.api.dto.SendCurrencyRequest;
import com.flagship.solid_ledger.chain.Address;
import com.flagship.solid_ledger.chain.Chain;
import com.flagship.solid_ledger.chain.Receipt;
import com.flagship.solid_ledger.chain.CurrencyNetwork;
import com.flagship.solid_ledger.observability.CorrelationIdFilter;
import com.flagship.solid_ledger.observability.TokenMetrics;
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
import org.springframework.web.bind.annotation.RestController;

/**
 * Backing-currency balances and plain sends.
 *
 * A plain send to the token's address buys units; a send to the reserve keeper
 * is an unconditional deposit.
 */
@RestController
@RequestMapping("/api/currency")
@RequiredArgsConstructor
@Slf4j
public class CurrencyController {

    private final CurrencyNetwork network;
    private final Chain chain;
    private final TokenMetrics tokenMetrics;

    @GetMapping("/{account}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("account") Address account) {
        return ResponseEntity.ok(new BalanceResponse(account, network.balanceOf(account)));
    }

    @PostMapping("/send")
    public ResponseEntity<OperationResponse> send(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) Address caller,
            @Valid @RequestBody SendCurrencyRequest request) {

        Receipt<Void> receipt = tokenMetrics.time("send", () -> chain.submit(() -> {
            network.transfer(caller, request.getTo(), request.getAmount());
            return null;
        }));
        log.info("Currency sent: to={}, amount={}", request.getTo(), request.getAmount());

        return ResponseEntity.ok(OperationResponse.ok("send", request.getAmount(), receipt.getBlock()));
    }
}
