package com.stableledger.adapter.token;

import com.stableledger.domain.AssetId;

import java.math.BigDecimal;

/**
 * Receive hook fired after an account is credited by a mint or a payout. A hook may call back into the
 * protocol; if it throws, the credit is undone and the exception propagates to the caller.
 */
@FunctionalInterface
public interface CreditListener {

    void onCredit(AssetId asset, String account, BigDecimal amount);
}
