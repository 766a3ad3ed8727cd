package com.stableledger.governance;

/**
 * Governable parameters, with their accepted ranges enforced by GovernanceParameterStore.
 */
public enum ParamType {
    MINT_FEE_BPS,
    REDEEM_FEE_BPS,
    BOND_FLOOR_PRICE,
    MAX_BOND_RATE,
    DEVIATION_TOLERANCE_BPS
}
