package com.stableledger.collateral.vault;

import com.stableledger.adapter.token.InMemoryTokenLedger;
import com.stableledger.collateral.config.CollateralProperties;
import com.stableledger.domain.AssetId;
import com.stableledger.domain.LedgerEntry;
import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;
import com.stableledger.domain.TokenLedgerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReserveVaultTest {

    private static final String ENGINE = "collateral-engine";
    private static final String VAULT = "reserve-vault";

    private InMemoryTokenLedger reserve;
    private InMemoryTokenLedger stable;
    private InMemoryTokenLedger backstop;
    private ReserveVault vault;

    @BeforeEach
    void setUp() {
        reserve = new InMemoryTokenLedger(AssetId.RESERVE, 8, VAULT);
        stable = new InMemoryTokenLedger(AssetId.STABLE, 18, VAULT);
        backstop = new InMemoryTokenLedger(AssetId.BACKSTOP, 18, VAULT);
        InMemoryTokenLedger bond = new InMemoryTokenLedger(AssetId.BOND, 18, VAULT);
        vault = new ReserveVault(new TokenLedgerRegistry(List.of(reserve, stable, backstop, bond)),
                new CollateralProperties());
        reserve.mint("alice", new BigDecimal("2"));
        reserve.approve("alice", new BigDecimal("2"));
        backstop.mint(VAULT, new BigDecimal("100"));
    }

    @Test
    @DisplayName("engine deposits and withdraws reserve through custody")
    void engineMovesReserve() {
        LedgerEntry in = vault.depositReserve(ENGINE, "alice", new BigDecimal("1.5"));
        vault.withdrawReserve(ENGINE, "bob", new BigDecimal("0.5"));

        assertThat(in.kind()).isEqualTo(LedgerEntry.Kind.TRANSFER_IN);
        assertThat(vault.balances().reserve()).isEqualByComparingTo("1");
        assertThat(reserve.balanceOf("bob")).isEqualByComparingTo("0.5");
    }

    @Test
    @DisplayName("any other caller is unauthorized")
    void otherCallersRejected() {
        assertThatThrownBy(() -> vault.withdrawReserve("alice", "alice", BigDecimal.ONE))
                .isInstanceOf(LedgerException.class)
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode()).isEqualTo(LedgerErrorCode.UNAUTHORIZED));
        assertThatThrownBy(() -> vault.compensate(null, "alice", BigDecimal.ONE))
                .isInstanceOf(LedgerException.class)
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode()).isEqualTo(LedgerErrorCode.UNAUTHORIZED));
    }

    @Test
    @DisplayName("compensation larger than the backstop reserve fails instead of under-paying")
    void compensateBounded() {
        vault.compensate(ENGINE, "alice", new BigDecimal("40"));
        assertThat(backstop.balanceOf("alice")).isEqualByComparingTo("40");

        assertThatThrownBy(() -> vault.compensate(ENGINE, "alice", new BigDecimal("60.000000000000000001")))
                .isInstanceOf(LedgerException.class)
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode())
                        .isEqualTo(LedgerErrorCode.INSUFFICIENT_FUNDS));
        assertThat(vault.balances().backstop()).isEqualByComparingTo("60");
    }

    @Test
    @DisplayName("balances report reserve, backstop and Stable held by the vault")
    void balances() {
        stable.mint(VAULT, new BigDecimal("7"));

        VaultBalances balances = vault.balances();

        assertThat(balances.reserve()).isZero();
        assertThat(balances.backstop()).isEqualByComparingTo("100");
        assertThat(balances.stableHeld()).isEqualByComparingTo("7");
    }
}
