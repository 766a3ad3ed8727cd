package com.stableledger.domain;

import java.math.BigDecimal;

/**
 * Fungible token ledger for one asset. The protocol holds tokens in a single custody account
 * (the reserve vault) and is the only minter and burner.
 * <p>
 * Failures are reported as {@link LedgerException} with INSUFFICIENT_FUNDS or INSUFFICIENT_ALLOWANCE.
 */
public interface TokenLedger {

    AssetId asset();

    /** Native decimals; amounts passed in must not carry more. */
    int decimals();

    /** Pulls {@code amount} from {@code from} into custody against the allowance granted to the protocol. */
    LedgerEntry transferIn(String from, BigDecimal amount);

    /** Pays {@code amount} out of custody to {@code to}. */
    LedgerEntry transferOut(String to, BigDecimal amount);

    LedgerEntry mint(String to, BigDecimal amount);

    LedgerEntry burn(String from, BigDecimal amount);

    BigDecimal balanceOf(String account);

    /** Allowance {@code owner} has granted to the protocol. */
    BigDecimal allowance(String owner);

    /** Undoes a mutation previously returned by this ledger. Does not notify credit listeners. */
    void revert(LedgerEntry entry);
}
