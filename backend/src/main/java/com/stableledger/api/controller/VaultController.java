package com.stableledger.api.controller;

import com.stableledger.collateral.vault.ReserveVault;
import com.stableledger.collateral.vault.VaultBalances;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/vault")
@RequiredArgsConstructor
public class VaultController {

    private final ReserveVault reserveVault;

    @GetMapping("/balances")
    public ResponseEntity<VaultBalances> balances() {
        return ResponseEntity.ok(reserveVault.balances());
    }
}
