package com.stableledger.pricing.feed;

import com.stableledger.domain.FeedReading;
import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;
import com.stableledger.domain.PriceFeed;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;

/**
 * Settable push feed. Seeded from stableledger.pricing.feeds; tests and local runs move it with {@link #set}.
 */
@Slf4j
public class ConfiguredPriceFeed implements PriceFeed {

    private final String feedId;
    private final int decimals;
    private final boolean attestOnRead;
    private final Clock clock;

    private volatile FeedReading reading;

    public ConfiguredPriceFeed(String feedId, int decimals, boolean attestOnRead, Clock clock) {
        this.feedId = feedId;
        this.decimals = decimals;
        this.attestOnRead = attestOnRead;
        this.clock = clock;
    }

    @Override
    public String feedId() {
        return feedId;
    }

    @Override
    public FeedReading latestPrice() {
        FeedReading current = reading;
        if (current == null) {
            throw new LedgerException(LedgerErrorCode.PRICE_UNAVAILABLE, "Feed " + feedId + " has no answer");
        }
        return attestOnRead ? new FeedReading(current.answer(), current.decimals(), clock.instant()) : current;
    }

    public void set(BigDecimal price) {
        set(price, clock.instant());
    }

    public void set(BigDecimal price, Instant asOf) {
        BigInteger answer = price.movePointRight(decimals).setScale(0, RoundingMode.FLOOR).toBigIntegerExact();
        reading = new FeedReading(answer, decimals, asOf);
        log.debug("Feed {} set to {} as of {}", feedId, price.toPlainString(), asOf);
    }
}
