package com.stableledger.keeper;

import com.stableledger.domain.LedgerException;
import com.stableledger.domain.LiquidityPoolRegistry;
import com.stableledger.pricing.twap.TimeWeightedPriceOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Pokes the TWAP oracle for every known pair. A poke is a no-op until the pair's newer observation is
 * a full period old, so the interval only needs to be shorter than the period.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ObservationKeeperJob {

    private final LiquidityPoolRegistry pools;
    private final TimeWeightedPriceOracle oracle;

    @Scheduled(
            fixedRateString = "${stableledger.keeper.poke-interval-ms:300000}",
            initialDelayString = "${stableledger.keeper.initial-delay-ms:5000}")
    public void runScheduled() {
        int recorded = 0;
        for (String pairId : pools.pairIds()) {
            try {
                if (oracle.recordObservationIfDue(pairId)) {
                    recorded++;
                }
            } catch (LedgerException e) {
                log.warn("Observation update for {} failed: {} {}", pairId, e.getErrorCode(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Observation update for {} failed: {}", pairId, e.getMessage(), e);
            }
        }
        log.debug("Keeper poke recorded {} observations", recorded);
    }
}
