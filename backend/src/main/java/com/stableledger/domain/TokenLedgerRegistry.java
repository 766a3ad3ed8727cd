package com.stableledger.domain;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * One token ledger per asset.
 */
public class TokenLedgerRegistry {

    private final Map<AssetId, TokenLedger> ledgers = new EnumMap<>(AssetId.class);

    public TokenLedgerRegistry(Collection<? extends TokenLedger> ledgers) {
        ledgers.forEach(l -> this.ledgers.put(l.asset(), l));
    }

    public TokenLedger get(AssetId asset) {
        TokenLedger ledger = ledgers.get(asset);
        if (ledger == null) {
            throw new IllegalStateException("No token ledger configured for " + asset);
        }
        return ledger;
    }

    public TokenLedger reserve() {
        return get(AssetId.RESERVE);
    }

    public TokenLedger stable() {
        return get(AssetId.STABLE);
    }

    public TokenLedger bond() {
        return get(AssetId.BOND);
    }

    public TokenLedger backstop() {
        return get(AssetId.BACKSTOP);
    }
}
