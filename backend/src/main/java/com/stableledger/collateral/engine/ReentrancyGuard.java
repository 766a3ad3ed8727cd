package com.stableledger.collateral.engine;

import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Per-engine entered flag. A call made while another engine call is in progress on the same
 * serializer turn (e.g. from a token receive hook) fails with REENTRANT_CALL.
 */
class ReentrancyGuard {

    private final AtomicBoolean entered = new AtomicBoolean();

    <T> T enter(Supplier<T> work) {
        if (!entered.compareAndSet(false, true)) {
            throw new LedgerException(LedgerErrorCode.REENTRANT_CALL, "Engine call already in progress");
        }
        try {
            return work.get();
        } finally {
            entered.set(false);
        }
    }

    boolean isEntered() {
        return entered.get();
    }
}
