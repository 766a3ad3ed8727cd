package com.stableledger.api.controller;

import com.stableledger.api.dto.AmountRequest;
import com.stableledger.api.dto.MintResponse;
import com.stableledger.api.dto.RatioResponse;
import com.stableledger.api.dto.RedeemResponse;
import com.stableledger.collateral.engine.BondRedemptionResult;
import com.stableledger.collateral.engine.CollateralEngine;
import com.stableledger.collateral.engine.PositionView;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Mint, redeem and bond redemption for the account in X-Account; position and collateral ratio reads.
 */
@RestController
@RequestMapping("/api/v1/collateral")
@RequiredArgsConstructor
public class CollateralController {

    private final CollateralEngine collateralEngine;

    @PostMapping("/mint")
    public ResponseEntity<MintResponse> mint(@RequestHeader(AccountHeaders.ACCOUNT) String account,
                                             @RequestBody @Valid AmountRequest request) {
        return ResponseEntity.ok(MintResponse.from(collateralEngine.mint(account, request.amount())));
    }

    @PostMapping("/redeem")
    public ResponseEntity<RedeemResponse> redeem(@RequestHeader(AccountHeaders.ACCOUNT) String account,
                                                 @RequestBody @Valid AmountRequest request) {
        return ResponseEntity.ok(RedeemResponse.from(collateralEngine.redeem(account, request.amount())));
    }

    @PostMapping("/bonds/redeem")
    public ResponseEntity<BondRedemptionResult> redeemBond(@RequestHeader(AccountHeaders.ACCOUNT) String account,
                                                           @RequestBody @Valid AmountRequest request) {
        return ResponseEntity.ok(collateralEngine.redeemBond(account, request.amount()));
    }

    @GetMapping("/position")
    public ResponseEntity<PositionView> position() {
        return ResponseEntity.ok(collateralEngine.position());
    }

    @GetMapping("/ratio")
    public ResponseEntity<RatioResponse> ratio() {
        return ResponseEntity.ok(new RatioResponse(collateralEngine.collateralRatio()));
    }
}
