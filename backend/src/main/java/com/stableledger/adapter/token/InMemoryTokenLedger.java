package com.stableledger.adapter.token;

import com.stableledger.domain.AssetId;
import com.stableledger.domain.LedgerEntry;
import com.stableledger.domain.LedgerEntry.Kind;
import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;
import com.stableledger.domain.TokenLedger;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Token ledger kept in memory for local runs and tests. Balances and allowances toward the protocol
 * are exact at the token's decimals; the custody account is the reserve vault.
 */
@Slf4j
public class InMemoryTokenLedger implements TokenLedger {

    private final AssetId asset;
    private final int decimals;
    private final String custodyAccount;
    private final Map<String, BigDecimal> balances = new HashMap<>();
    private final Map<String, BigDecimal> allowances = new HashMap<>();
    private final List<CreditListener> listeners = new CopyOnWriteArrayList<>();
    private BigDecimal totalSupply = BigDecimal.ZERO;

    public InMemoryTokenLedger(AssetId asset, int decimals, String custodyAccount) {
        this.asset = asset;
        this.decimals = decimals;
        this.custodyAccount = custodyAccount;
    }

    @Override
    public AssetId asset() {
        return asset;
    }

    @Override
    public int decimals() {
        return decimals;
    }

    public String custodyAccount() {
        return custodyAccount;
    }

    public void addCreditListener(CreditListener listener) {
        listeners.add(listener);
    }

    public void removeCreditListener(CreditListener listener) {
        listeners.remove(listener);
    }

    /** Sets the allowance {@code owner} grants to the protocol. */
    public synchronized void approve(String owner, BigDecimal amount) {
        BigDecimal exact = exact(amount, true);
        allowances.put(owner, exact);
        log.debug("{} allowance of {} set to {}", asset, owner, exact.toPlainString());
    }

    @Override
    public LedgerEntry transferIn(String from, BigDecimal amount) {
        BigDecimal exact = exact(amount, false);
        synchronized (this) {
            if (allowance(from).compareTo(exact) < 0) {
                throw new LedgerException(LedgerErrorCode.INSUFFICIENT_ALLOWANCE,
                        asset + " allowance of " + from + " is below " + exact.toPlainString());
            }
            requireBalance(from, exact);
            allowances.put(from, allowance(from).subtract(exact));
            move(from, custodyAccount, exact);
        }
        return new LedgerEntry(Kind.TRANSFER_IN, asset, from, exact);
    }

    @Override
    public LedgerEntry transferOut(String to, BigDecimal amount) {
        BigDecimal exact = exact(amount, false);
        synchronized (this) {
            requireBalance(custodyAccount, exact);
            move(custodyAccount, to, exact);
        }
        LedgerEntry entry = new LedgerEntry(Kind.TRANSFER_OUT, asset, to, exact);
        notifyCredit(entry);
        return entry;
    }

    @Override
    public LedgerEntry mint(String to, BigDecimal amount) {
        BigDecimal exact = exact(amount, false);
        synchronized (this) {
            credit(to, exact);
            totalSupply = totalSupply.add(exact);
        }
        LedgerEntry entry = new LedgerEntry(Kind.MINT, asset, to, exact);
        notifyCredit(entry);
        return entry;
    }

    @Override
    public synchronized LedgerEntry burn(String from, BigDecimal amount) {
        BigDecimal exact = exact(amount, false);
        requireBalance(from, exact);
        credit(from, exact.negate());
        totalSupply = totalSupply.subtract(exact);
        return new LedgerEntry(Kind.BURN, asset, from, exact);
    }

    @Override
    public synchronized BigDecimal balanceOf(String account) {
        return balances.getOrDefault(account, BigDecimal.ZERO);
    }

    @Override
    public synchronized BigDecimal allowance(String owner) {
        return allowances.getOrDefault(owner, BigDecimal.ZERO);
    }

    public synchronized BigDecimal totalSupply() {
        return totalSupply;
    }

    @Override
    public synchronized void revert(LedgerEntry entry) {
        if (entry.asset() != asset) {
            throw new IllegalArgumentException("Entry for " + entry.asset() + " reverted on " + asset + " ledger");
        }
        BigDecimal amount = entry.amount();
        switch (entry.kind()) {
            case TRANSFER_IN -> {
                move(custodyAccount, entry.account(), amount);
                allowances.put(entry.account(), allowance(entry.account()).add(amount));
            }
            case TRANSFER_OUT -> move(entry.account(), custodyAccount, amount);
            case MINT -> {
                credit(entry.account(), amount.negate());
                totalSupply = totalSupply.subtract(amount);
            }
            case BURN -> {
                credit(entry.account(), amount);
                totalSupply = totalSupply.add(amount);
            }
        }
        log.debug("Reverted {} {} {} for {}", entry.kind(), amount.toPlainString(), asset, entry.account());
    }

    private void notifyCredit(LedgerEntry entry) {
        for (CreditListener listener : listeners) {
            try {
                listener.onCredit(asset, entry.account(), entry.amount());
            } catch (RuntimeException e) {
                revert(entry);
                throw e;
            }
        }
    }

    private void requireBalance(String account, BigDecimal amount) {
        if (balanceOf(account).compareTo(amount) < 0) {
            throw new LedgerException(LedgerErrorCode.INSUFFICIENT_FUNDS,
                    asset + " balance of " + account + " is below " + amount.toPlainString());
        }
    }

    private void move(String from, String to, BigDecimal amount) {
        credit(from, amount.negate());
        credit(to, amount);
    }

    private void credit(String account, BigDecimal delta) {
        BigDecimal next = balanceOf(account).add(delta);
        if (next.signum() < 0) {
            throw new IllegalStateException(asset + " balance of " + account + " would go negative");
        }
        balances.put(account, next);
    }

    private BigDecimal exact(BigDecimal amount, boolean allowZero) {
        if (amount == null || amount.signum() < 0 || (!allowZero && amount.signum() == 0)) {
            throw new IllegalArgumentException("Invalid " + asset + " amount: " + amount);
        }
        if (amount.stripTrailingZeros().scale() > decimals) {
            throw new IllegalArgumentException(asset + " amount " + amount.toPlainString()
                    + " has more than " + decimals + " decimals");
        }
        return amount.setScale(decimals);
    }
}
