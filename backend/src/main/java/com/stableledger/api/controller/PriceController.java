package com.stableledger.api.controller;

import com.stableledger.api.dto.PokeResponse;
import com.stableledger.api.dto.UnitOfAccountResponse;
import com.stableledger.domain.AssetId;
import com.stableledger.domain.LiquidityPoolRegistry;
import com.stableledger.domain.TrustedPrice;
import com.stableledger.pricing.PriceValidator;
import com.stableledger.pricing.UnitOfAccountIndex;
import com.stableledger.pricing.twap.ObservationInfo;
import com.stableledger.pricing.twap.TimeWeightedPriceOracle;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Trusted prices, the unit-of-account index and per-pair TWAP readiness with a manual poke.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class PriceController {

    private final PriceValidator priceValidator;
    private final UnitOfAccountIndex unitOfAccountIndex;
    private final TimeWeightedPriceOracle oracle;
    private final LiquidityPoolRegistry pools;

    @GetMapping("/prices/{asset}")
    public ResponseEntity<TrustedPrice> trustedPrice(@PathVariable AssetId asset) {
        return ResponseEntity.ok(priceValidator.getTrustedPrice(asset));
    }

    @GetMapping("/unit-of-account")
    public ResponseEntity<UnitOfAccountResponse> unitOfAccount() {
        return ResponseEntity.ok(new UnitOfAccountResponse(unitOfAccountIndex.current(), unitOfAccountIndex.history()));
    }

    @GetMapping("/oracle/pairs")
    public ResponseEntity<List<ObservationInfo>> pairs() {
        return ResponseEntity.ok(pools.pairIds().stream().map(oracle::observationInfo).toList());
    }

    @GetMapping("/oracle/pairs/{pairId}")
    public ResponseEntity<ObservationInfo> pair(@PathVariable String pairId) {
        return ResponseEntity.ok(oracle.observationInfo(pairId));
    }

    @PostMapping("/oracle/pairs/{pairId}/poke")
    public ResponseEntity<PokeResponse> poke(@PathVariable String pairId) {
        return ResponseEntity.ok(new PokeResponse(pairId, oracle.recordObservationIfDue(pairId)));
    }
}
