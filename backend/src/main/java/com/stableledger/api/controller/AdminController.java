package com.stableledger.api.controller;

import com.stableledger.api.dto.AdminTransferRequest;
import com.stableledger.api.dto.ParamUpdateRequest;
import com.stableledger.collateral.engine.CollateralEngine;
import com.stableledger.governance.GovernanceParameterStore;
import com.stableledger.governance.ParamType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Administrator operations: pause, two-step admin transfer and governance parameter writes.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final CollateralEngine collateralEngine;
    private final GovernanceParameterStore governanceParameterStore;

    @PostMapping("/pause")
    public ResponseEntity<Void> pause(@RequestHeader(AccountHeaders.ACCOUNT) String account) {
        collateralEngine.pause(account);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/unpause")
    public ResponseEntity<Void> unpause(@RequestHeader(AccountHeaders.ACCOUNT) String account) {
        collateralEngine.unpause(account);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/transfer")
    public ResponseEntity<Void> transfer(@RequestHeader(AccountHeaders.ACCOUNT) String account,
                                         @RequestBody @Valid AdminTransferRequest request) {
        collateralEngine.transferAdmin(account, request.candidate());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/accept")
    public ResponseEntity<Void> accept(@RequestHeader(AccountHeaders.ACCOUNT) String account) {
        collateralEngine.acceptAdmin(account);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/cancel")
    public ResponseEntity<Void> cancel(@RequestHeader(AccountHeaders.ACCOUNT) String account) {
        collateralEngine.cancelAdminTransfer(account);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/params")
    public ResponseEntity<Map<ParamType, BigDecimal>> params() {
        return ResponseEntity.ok(governanceParameterStore.all());
    }

    @PutMapping("/params/{type}")
    public ResponseEntity<Map<ParamType, BigDecimal>> setParam(@RequestHeader(AccountHeaders.ACCOUNT) String account,
                                                               @PathVariable ParamType type,
                                                               @RequestBody @Valid ParamUpdateRequest request) {
        return ResponseEntity.ok(collateralEngine.setParam(account, type, request.value()));
    }
}
