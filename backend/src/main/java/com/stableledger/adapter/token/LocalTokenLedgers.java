package com.stableledger.adapter.token;

import com.stableledger.domain.AssetId;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The in-memory ledgers of a local deployment, for the token endpoints and test fixtures.
 */
public class LocalTokenLedgers {

    private final Map<AssetId, InMemoryTokenLedger> ledgers = new EnumMap<>(AssetId.class);

    public LocalTokenLedgers(Collection<InMemoryTokenLedger> ledgers) {
        ledgers.forEach(l -> this.ledgers.put(l.asset(), l));
    }

    public Optional<InMemoryTokenLedger> find(AssetId asset) {
        return Optional.ofNullable(ledgers.get(asset));
    }

    public Collection<InMemoryTokenLedger> all() {
        return Collections.unmodifiableCollection(ledgers.values());
    }
}
