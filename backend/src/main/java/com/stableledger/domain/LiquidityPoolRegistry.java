package com.stableledger.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Pools known to the protocol, keyed by pair id.
 */
public class LiquidityPoolRegistry {

    private final Map<String, LiquidityPool> pools = new LinkedHashMap<>();

    public LiquidityPoolRegistry(Collection<? extends LiquidityPool> pools) {
        pools.forEach(p -> this.pools.put(p.pairId(), p));
    }

    public LiquidityPool require(String pairId) {
        LiquidityPool pool = pools.get(pairId);
        if (pool == null) {
            throw new LedgerException(LedgerErrorCode.PRICE_UNAVAILABLE, "Unknown pair: " + pairId);
        }
        return pool;
    }

    public Set<String> pairIds() {
        return Collections.unmodifiableSet(pools.keySet());
    }
}
