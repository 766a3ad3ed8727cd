package com.stableledger.domain;

import java.math.BigDecimal;

/**
 * Receipt of one token ledger mutation. Handed back to {@link TokenLedger#revert(LedgerEntry)} to undo it.
 */
public record LedgerEntry(Kind kind, AssetId asset, String account, BigDecimal amount) {

    public enum Kind {
        /** account → custody, consumes allowance. */
        TRANSFER_IN,
        /** custody → account. */
        TRANSFER_OUT,
        MINT,
        BURN
    }
}
