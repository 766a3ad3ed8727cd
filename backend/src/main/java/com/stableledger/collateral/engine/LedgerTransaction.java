package com.stableledger.collateral.engine;

import com.stableledger.domain.LedgerEntry;
import com.stableledger.domain.TokenLedgerRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Journal of the token ledger effects of one engine request. On failure the effects are reverted
 * newest first.
 */
@Slf4j
class LedgerTransaction {

    private final TokenLedgerRegistry ledgers;
    private final Deque<LedgerEntry> journal = new ArrayDeque<>();

    LedgerTransaction(TokenLedgerRegistry ledgers) {
        this.ledgers = ledgers;
    }

    LedgerEntry record(LedgerEntry entry) {
        journal.push(entry);
        return entry;
    }

    List<LedgerEntry> entries() {
        return List.copyOf(journal);
    }

    /**
     * Reverts every recorded effect. A revert that itself fails is attached to {@code cause} and the
     * remaining effects are still reverted.
     */
    void rollback(RuntimeException cause) {
        while (!journal.isEmpty()) {
            LedgerEntry entry = journal.pop();
            try {
                ledgers.get(entry.asset()).revert(entry);
            } catch (RuntimeException e) {
                log.error("Failed to revert {} of {} {} for {}", entry.kind(), entry.amount().toPlainString(),
                        entry.asset(), entry.account(), e);
                cause.addSuppressed(e);
            }
        }
    }
}
