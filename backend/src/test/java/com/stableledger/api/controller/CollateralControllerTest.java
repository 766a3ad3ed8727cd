package com.stableledger.api.controller;

import com.stableledger.collateral.engine.CollateralEngine;
import com.stableledger.collateral.engine.MintResult;
import com.stableledger.collateral.engine.RedemptionResult;
import com.stableledger.collateral.engine.RedemptionTier;
import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;
import com.stableledger.governance.GovernanceParameterStore;
import com.stableledger.governance.GovernanceProperties;
import com.stableledger.governance.ParamType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CollateralControllerTest {

    @Mock
    private CollateralEngine collateralEngine;

    private GovernanceParameterStore governance;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        governance = new GovernanceParameterStore(new GovernanceProperties());
        client = WebTestClient.bindToController(
                        new CollateralController(collateralEngine),
                        new AdminController(collateralEngine, governance))
                .controllerAdvice(new LedgerExceptionHandler(), new ValidationExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("mint returns the amounts credited to the caller")
    void mint() {
        when(collateralEngine.mint("alice", new BigDecimal("1")))
                .thenReturn(new MintResult(BigDecimal.ONE, new BigDecimal("50000"), new BigDecimal("49750"),
                        new BigDecimal("250"), new BigDecimal("50000"), BigDecimal.ONE));

        client.post().uri("/api/v1/collateral/mint")
                .header(AccountHeaders.ACCOUNT, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"amount\": 1}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.stableToCaller").isEqualTo(49750)
                .jsonPath("$.fee").isEqualTo(250);
    }

    @Test
    @DisplayName("redeem reports the tier used")
    void redeem() {
        when(collateralEngine.redeem("alice", new BigDecimal("1000")))
                .thenReturn(new RedemptionResult(RedemptionTier.RESERVE_AND_BOND, new BigDecimal("1000"),
                        BigDecimal.ZERO, new BigDecimal("0.02"), new BigDecimal("400"), BigDecimal.ZERO,
                        new BigDecimal("0.5")));

        client.post().uri("/api/v1/collateral/redeem")
                .header(AccountHeaders.ACCOUNT, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"amount\": 1000}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.tier").isEqualTo("RESERVE_AND_BOND")
                .jsonPath("$.bondOut").isEqualTo(400);
    }

    @Test
    @DisplayName("missing amount is rejected before reaching the engine")
    void missingAmount() {
        client.post().uri("/api/v1/collateral/mint")
                .header(AccountHeaders.ACCOUNT, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_AMOUNT");
        verifyNoInteractions(collateralEngine);
    }

    @Test
    @DisplayName("ledger failures map to their HTTP status and error code")
    void ledgerFailures() {
        when(collateralEngine.redeem(any(), any()))
                .thenThrow(new LedgerException(LedgerErrorCode.PRICE_DEVIATION, "pool off"));
        when(collateralEngine.mint(any(), any()))
                .thenThrow(new LedgerException(LedgerErrorCode.PAUSED, "paused"));

        client.post().uri("/api/v1/collateral/redeem")
                .header(AccountHeaders.ACCOUNT, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"amount\": 5}")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("PRICE_DEVIATION");

        client.post().uri("/api/v1/collateral/mint")
                .header(AccountHeaders.ACCOUNT, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"amount\": 5}")
                .exchange()
                .expectStatus().isEqualTo(423);
    }

    @Test
    @DisplayName("governance write by a non-admin is forbidden and changes nothing")
    void paramWriteRequiresAdmin() {
        when(collateralEngine.setParam(eq("mallory"), eq(ParamType.MINT_FEE_BPS), any(BigDecimal.class)))
                .thenThrow(new LedgerException(LedgerErrorCode.UNAUTHORIZED, "not admin"));

        client.put().uri("/api/v1/admin/params/MINT_FEE_BPS")
                .header(AccountHeaders.ACCOUNT, "mallory")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"value\": 0}")
                .exchange()
                .expectStatus().isForbidden();

        assertThat(governance.mintFeeBps()).isEqualTo(50);
    }

    @Test
    @DisplayName("out-of-range governance value is a 400")
    void paramOutOfRange() {
        writesThroughToStore();

        client.put().uri("/api/v1/admin/params/REDEEM_FEE_BPS")
                .header(AccountHeaders.ACCOUNT, "admin")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"value\": 5000}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_PARAMETER");

        assertThat(governance.all()).containsEntry(ParamType.REDEEM_FEE_BPS, BigDecimal.valueOf(50));
    }

    @Test
    @DisplayName("admin governance write returns every parameter after the change")
    void paramWrite() {
        writesThroughToStore();

        client.put().uri("/api/v1/admin/params/MINT_FEE_BPS")
                .header(AccountHeaders.ACCOUNT, "admin")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"value\": 10}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.MINT_FEE_BPS").isEqualTo(10)
                .jsonPath("$.REDEEM_FEE_BPS").isEqualTo(50);

        assertThat(governance.mintFeeBps()).isEqualTo(10);
    }

    private void writesThroughToStore() {
        when(collateralEngine.setParam(eq("admin"), any(ParamType.class), any(BigDecimal.class)))
                .thenAnswer(inv -> {
                    governance.setParam(inv.getArgument(1), inv.getArgument(2));
                    return governance.all();
                });
    }

    @Test
    @DisplayName("every error code has a status")
    void everyCodeMapped() {
        for (LedgerErrorCode code : LedgerErrorCode.values()) {
            assertThat(LedgerExceptionHandler.statusOf(code)).isNotNull();
        }
    }
}
