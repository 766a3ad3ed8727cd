package com.stableledger.keeper;

import com.stableledger.domain.LedgerException;
import com.stableledger.pricing.IndexUpdate;
import com.stableledger.pricing.UnitOfAccountIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic unit-of-account index refresh from the PCE feed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UnitOfAccountRefreshJob {

    private final UnitOfAccountIndex unitOfAccountIndex;

    @Scheduled(
            fixedRateString = "${stableledger.keeper.index-refresh-interval-ms:3600000}",
            initialDelayString = "${stableledger.keeper.initial-delay-ms:5000}")
    public void runScheduled() {
        try {
            IndexUpdate update = unitOfAccountIndex.refresh();
            log.info("Unit of account at {}", update.value().toPlainString());
        } catch (LedgerException e) {
            log.warn("Unit-of-account refresh failed: {} {}", e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unit-of-account refresh failed: {}", e.getMessage(), e);
        }
    }
}
