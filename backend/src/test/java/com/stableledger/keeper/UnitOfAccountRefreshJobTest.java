package com.stableledger.keeper;

import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;
import com.stableledger.pricing.IndexUpdate;
import com.stableledger.pricing.UnitOfAccountIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UnitOfAccountRefreshJobTest {

    @Mock
    private UnitOfAccountIndex unitOfAccountIndex;

    @InjectMocks
    private UnitOfAccountRefreshJob job;

    @Test
    @DisplayName("scheduled job delegates to the index refresh")
    void runScheduled_delegatesToIndex() {
        when(unitOfAccountIndex.refresh()).thenReturn(new IndexUpdate(Instant.now(), BigDecimal.ONE, new BigDecimal("120")));

        job.runScheduled();

        verify(unitOfAccountIndex).refresh();
    }

    @Test
    @DisplayName("unavailable PCE feed is logged, not thrown")
    void runScheduled_feedUnavailable() {
        when(unitOfAccountIndex.refresh()).thenThrow(new LedgerException(LedgerErrorCode.PRICE_UNAVAILABLE, "stale"));

        assertThatCode(job::runScheduled).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("failure to store the refreshed index is logged, not thrown")
    void runScheduled_storageFailure() {
        when(unitOfAccountIndex.refresh()).thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThatCode(job::runScheduled).doesNotThrowAnyException();
    }
}
