package com.stableledger.domain;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Push feeds by feed id.
 */
public class PriceFeedRegistry {

    private final Map<String, PriceFeed> feeds = new LinkedHashMap<>();

    public PriceFeedRegistry(Collection<? extends PriceFeed> feeds) {
        feeds.forEach(f -> this.feeds.put(f.feedId(), f));
    }

    public Optional<PriceFeed> find(String feedId) {
        return Optional.ofNullable(feeds.get(feedId));
    }
}
