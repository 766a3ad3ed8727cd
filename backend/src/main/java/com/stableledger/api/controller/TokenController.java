package com.stableledger.api.controller;

import com.stableledger.adapter.token.InMemoryTokenLedger;
import com.stableledger.adapter.token.LocalTokenLedgers;
import com.stableledger.api.dto.AmountRequest;
import com.stableledger.api.dto.BalanceResponse;
import com.stableledger.api.dto.ErrorBody;
import com.stableledger.domain.AssetId;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Local token ledgers: approve the protocol and read balances.
 */
@RestController
@RequestMapping("/api/v1/tokens/{asset}")
@RequiredArgsConstructor
public class TokenController {

    private final LocalTokenLedgers localTokenLedgers;

    @PostMapping("/approve")
    public ResponseEntity<?> approve(@RequestHeader(AccountHeaders.ACCOUNT) String account,
                                     @PathVariable AssetId asset,
                                     @RequestBody @Valid AmountRequest request) {
        Optional<InMemoryTokenLedger> ledger = localTokenLedgers.find(asset);
        if (ledger.isEmpty()) {
            return notFound(asset);
        }
        ledger.get().approve(account, request.amount());
        return ResponseEntity.ok(view(ledger.get(), account));
    }

    @GetMapping("/balances/{account}")
    public ResponseEntity<?> balance(@PathVariable AssetId asset, @PathVariable String account) {
        return localTokenLedgers.find(asset)
                .<ResponseEntity<?>>map(l -> ResponseEntity.ok(view(l, account)))
                .orElseGet(() -> notFound(asset));
    }

    private static BalanceResponse view(InMemoryTokenLedger ledger, String account) {
        return new BalanceResponse(ledger.asset().name(), account, ledger.balanceOf(account), ledger.allowance(account));
    }

    private static ResponseEntity<?> notFound(AssetId asset) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorBody.of("LEDGER_NOT_FOUND", "No local ledger for " + asset));
    }
}
