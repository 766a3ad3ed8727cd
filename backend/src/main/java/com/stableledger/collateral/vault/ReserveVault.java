package com.stableledger.collateral.vault;

import com.stableledger.collateral.config.CollateralProperties;
import com.stableledger.domain.LedgerEntry;
import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;
import com.stableledger.domain.TokenLedgerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Custody of the reserve asset and the backstop reserve. Moves assets only when called by the
 * collateral engine's account; balances are readable by anyone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReserveVault {

    private final TokenLedgerRegistry ledgers;
    private final CollateralProperties collateralProperties;

    /** Pulls reserve from {@code from} into custody. */
    public LedgerEntry depositReserve(String caller, String from, BigDecimal amount) {
        requireEngine(caller);
        return ledgers.reserve().transferIn(from, amount);
    }

    public LedgerEntry withdrawReserve(String caller, String to, BigDecimal amount) {
        requireEngine(caller);
        return ledgers.reserve().transferOut(to, amount);
    }

    /**
     * Pays {@code backstopAmount} from the backstop reserve. Fails rather than paying less.
     */
    public LedgerEntry compensate(String caller, String recipient, BigDecimal backstopAmount) {
        requireEngine(caller);
        BigDecimal available = ledgers.backstop().balanceOf(vaultAccount());
        if (available.compareTo(backstopAmount) < 0) {
            log.warn("Backstop reserve {} cannot cover compensation of {}", available.toPlainString(),
                    backstopAmount.toPlainString());
            throw new LedgerException(LedgerErrorCode.INSUFFICIENT_FUNDS,
                    "Backstop reserve " + available.toPlainString() + " is below " + backstopAmount.toPlainString());
        }
        return ledgers.backstop().transferOut(recipient, backstopAmount);
    }

    public VaultBalances balances() {
        String vault = vaultAccount();
        return new VaultBalances(
                ledgers.reserve().balanceOf(vault),
                ledgers.backstop().balanceOf(vault),
                ledgers.stable().balanceOf(vault));
    }

    public String vaultAccount() {
        return collateralProperties.getVaultAccount();
    }

    private void requireEngine(String caller) {
        if (caller == null || !caller.equals(collateralProperties.getEngineAccount())) {
            log.warn("Rejected vault call from {}", caller);
            throw new LedgerException(LedgerErrorCode.UNAUTHORIZED, "Only the collateral engine may move vault assets");
        }
    }
}
