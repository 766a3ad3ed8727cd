package com.stableledger.collateral.engine;

import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;

import java.util.Optional;

/**
 * Administrator with two-step hand-over: the current admin nominates, the candidate accepts.
 */
class AdminRole {

    interface TransferState {
    }

    record NoPendingTransfer() implements TransferState {
    }

    record PendingTransfer(String candidate) implements TransferState {
    }

    private volatile String admin;
    private volatile TransferState state = new NoPendingTransfer();

    AdminRole(String admin) {
        this.admin = admin;
    }

    String admin() {
        return admin;
    }

    TransferState state() {
        return state;
    }

    Optional<String> pendingCandidate() {
        return state instanceof PendingTransfer pending ? Optional.of(pending.candidate()) : Optional.empty();
    }

    void requireAdmin(String caller) {
        if (caller == null || !caller.equals(admin)) {
            throw new LedgerException(LedgerErrorCode.UNAUTHORIZED, "Caller is not the administrator");
        }
    }

    void transfer(String caller, String candidate) {
        requireAdmin(caller);
        if (candidate == null || candidate.isBlank()) {
            throw new IllegalArgumentException("Candidate account is required");
        }
        state = new PendingTransfer(candidate);
    }

    void accept(String caller) {
        if (!(state instanceof PendingTransfer pending) || !pending.candidate().equals(caller)) {
            throw new LedgerException(LedgerErrorCode.UNAUTHORIZED, "Caller is not the pending administrator");
        }
        admin = pending.candidate();
        state = new NoPendingTransfer();
    }

    void cancel(String caller) {
        requireAdmin(caller);
        state = new NoPendingTransfer();
    }
}
