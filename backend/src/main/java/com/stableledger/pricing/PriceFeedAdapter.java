package com.stableledger.pricing;

import com.stableledger.common.FixedPoint;
import com.stableledger.domain.FeedReading;
import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;
import com.stableledger.domain.PriceFeed;
import com.stableledger.domain.PriceFeedRegistry;
import com.stableledger.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Reads push feeds, normalizes answers to 18 decimals and rejects stale or non-positive readings.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PriceFeedAdapter {

    private final PriceFeedRegistry feeds;
    private final PricingProperties pricingProperties;
    private final Clock clock;

    /**
     * @throws LedgerException PRICE_UNAVAILABLE for an unknown, empty, stale or non-positive feed
     */
    public NormalizedPrice read(String feedId) {
        PriceFeed feed = feeds.find(feedId)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.PRICE_UNAVAILABLE, "Unknown feed: " + feedId));
        FeedReading reading = feed.latestPrice();
        if (reading == null || reading.answer() == null || reading.asOf() == null) {
            throw new LedgerException(LedgerErrorCode.PRICE_UNAVAILABLE, "Feed " + feedId + " returned no reading");
        }
        if (reading.answer().signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.PRICE_UNAVAILABLE,
                    "Feed " + feedId + " returned non-positive answer " + reading.answer());
        }
        Instant now = clock.instant();
        Duration age = Duration.between(reading.asOf(), now);
        if (age.getSeconds() > pricingProperties.getMaxFeedAgeSeconds()) {
            log.warn("Feed {} is stale: last update {} ({}s ago)", feedId, reading.asOf(), age.getSeconds());
            throw new LedgerException(LedgerErrorCode.PRICE_UNAVAILABLE,
                    "Feed " + feedId + " is stale, last update " + reading.asOf());
        }
        return new NormalizedPrice(feedId, normalize(reading), reading.asOf());
    }

    static BigDecimal normalize(FeedReading reading) {
        return FixedPoint.of(new BigDecimal(reading.answer(), reading.decimals()));
    }
}
