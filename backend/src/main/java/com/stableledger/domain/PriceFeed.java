package com.stableledger.domain;

/**
 * Push price source (oracle network or HTTP API).
 */
public interface PriceFeed {

    String feedId();

    /**
     * @throws LedgerException PRICE_UNAVAILABLE when the source has no answer
     */
    FeedReading latestPrice();
}
