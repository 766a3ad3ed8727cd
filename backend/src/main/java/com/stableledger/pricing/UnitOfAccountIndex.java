package com.stableledger.pricing;

import com.stableledger.common.FixedPoint;
import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;
import com.stableledger.domain.UnitOfAccountState;
import com.stableledger.domain.UnitOfAccountStateRepository;
import com.stableledger.pricing.config.PricingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Inflation-indexed dollar (Ideal USD). value = initialValue × pceNow / pceBase, where pceBase is the
 * first PCE reading taken. The base and a bounded history of refreshes are stored in unit_of_account
 * and reloaded on startup.
 */
@Component
@Slf4j
public class UnitOfAccountIndex {

    private final PriceFeedAdapter priceFeedAdapter;
    private final UnitOfAccountStateRepository stateRepository;
    private final PricingProperties.UnitOfAccountProperties properties;
    private final Clock clock;

    private final Deque<IndexUpdate> history = new ArrayDeque<>();
    private BigDecimal pceBase;
    private volatile IndexUpdate latest;

    public UnitOfAccountIndex(PriceFeedAdapter priceFeedAdapter, UnitOfAccountStateRepository stateRepository,
                              PricingProperties pricingProperties, Clock clock) {
        this.priceFeedAdapter = priceFeedAdapter;
        this.stateRepository = stateRepository;
        this.properties = pricingProperties.getUnitOfAccount();
        this.clock = clock;
        restore();
    }

    private void restore() {
        stateRepository.findById(UnitOfAccountState.GLOBAL_ID).ifPresent(state -> {
            pceBase = state.getPceBase();
            for (UnitOfAccountState.Update u : state.getUpdates()) {
                history.addLast(new IndexUpdate(u.timestamp(), u.value(), u.pce()));
            }
            trim(history);
            latest = history.peekLast();
            log.info("Unit-of-account index restored: base PCE {}, {} updates", pceBase, history.size());
        });
    }

    /**
     * Reads the PCE feed and appends a new index value.
     *
     * @throws LedgerException PRICE_UNAVAILABLE when indexing is disabled or the feed cannot be read
     */
    public synchronized IndexUpdate refresh() {
        String feedId = properties.getPceFeedId();
        if (feedId == null || feedId.isBlank()) {
            throw new LedgerException(LedgerErrorCode.PRICE_UNAVAILABLE, "No PCE feed configured");
        }
        BigDecimal pce = priceFeedAdapter.read(feedId).value();
        BigDecimal base = pceBase != null ? pceBase : pce;
        BigDecimal value = FixedPoint.mulDiv(FixedPoint.of(properties.getInitialValue()), pce, base, FixedPoint.SCALE);
        IndexUpdate update = new IndexUpdate(clock.instant(), value, pce);

        Deque<IndexUpdate> next = new ArrayDeque<>(history);
        next.addLast(update);
        trim(next);
        save(base, next);

        if (pceBase == null) {
            log.info("Unit-of-account index based at PCE {}", pce.toPlainString());
        }
        pceBase = base;
        history.clear();
        history.addAll(next);
        latest = update;
        log.debug("Unit-of-account index refreshed to {}", value.toPlainString());
        return update;
    }

    private void trim(Deque<IndexUpdate> updates) {
        while (updates.size() > Math.max(1, properties.getHistorySize())) {
            updates.removeFirst();
        }
    }

    // Written before the in-memory state moves, so a failed save leaves both unchanged.
    private void save(BigDecimal base, Deque<IndexUpdate> updates) {
        UnitOfAccountState state = new UnitOfAccountState(base);
        for (IndexUpdate u : updates) {
            state.getUpdates().add(new UnitOfAccountState.Update(u.timestamp(), u.value(), u.pce()));
        }
        stateRepository.save(state);
    }

    /** Latest value, or the configured initial value before the first refresh. */
    public BigDecimal current() {
        IndexUpdate last = latest;
        return last != null ? last.value() : FixedPoint.of(properties.getInitialValue());
    }

    public IndexUpdate latestUpdate() {
        IndexUpdate last = latest;
        if (last == null) {
            throw new LedgerException(LedgerErrorCode.PRICE_UNAVAILABLE, "Unit-of-account index has no updates");
        }
        return last;
    }

    public synchronized List<IndexUpdate> history() {
        return new ArrayList<>(history);
    }
}
