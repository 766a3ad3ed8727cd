package com.stableledger.pricing.feed;

import com.stableledger.domain.FeedReading;
import com.stableledger.domain.PriceFeed;

/**
 * Multiplies two feeds, e.g. BTC/USD × WBTC/BTC. Exact: answers multiply and decimals add.
 * The reading is as old as its older component.
 */
public class ProductPriceFeed implements PriceFeed {

    private final String feedId;
    private final PriceFeed first;
    private final PriceFeed second;

    public ProductPriceFeed(String feedId, PriceFeed first, PriceFeed second) {
        this.feedId = feedId;
        this.first = first;
        this.second = second;
    }

    @Override
    public String feedId() {
        return feedId;
    }

    @Override
    public FeedReading latestPrice() {
        FeedReading a = first.latestPrice();
        FeedReading b = second.latestPrice();
        return new FeedReading(
                a.answer().multiply(b.answer()),
                a.decimals() + b.decimals(),
                a.asOf().isBefore(b.asOf()) ? a.asOf() : b.asOf());
    }
}
