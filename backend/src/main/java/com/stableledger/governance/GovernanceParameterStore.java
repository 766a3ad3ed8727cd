package com.stableledger.governance;

import com.stableledger.common.FixedPoint;
import com.stableledger.domain.GovernanceParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Holds the governable parameters. Reads see a consistent snapshot; writes are range-checked.
 * Voting and timelock live outside this service.
 */
@Component
@Slf4j
public class GovernanceParameterStore implements GovernanceParameters {

    static final int MAX_FEE_BPS = 1_000;
    static final int MAX_TOLERANCE_BPS = 5_000;
    static final int MAX_BOND_RATE_BPS = 10_000;

    private volatile Snapshot snapshot;

    public GovernanceParameterStore(GovernanceProperties properties) {
        Snapshot initial = new Snapshot(properties.getMintFeeBps(), properties.getRedeemFeeBps(),
                FixedPoint.of(properties.getBondFloorPrice()), properties.getMaxBondRate(),
                properties.getDeviationToleranceBps());
        for (ParamType type : ParamType.values()) {
            validate(type, initial.get(type));
        }
        this.snapshot = initial;
    }

    @Override
    public int mintFeeBps() {
        return snapshot.mintFeeBps();
    }

    @Override
    public int redeemFeeBps() {
        return snapshot.redeemFeeBps();
    }

    @Override
    public BigDecimal bondFloorPrice() {
        return snapshot.bondFloorPrice();
    }

    @Override
    public int maxBondRate() {
        return snapshot.maxBondRate();
    }

    @Override
    public int deviationToleranceBps() {
        return snapshot.deviationToleranceBps();
    }

    @Override
    public GovernanceParameters snapshot() {
        return snapshot;
    }

    /**
     * Range-checks and stores one parameter. Callers that need the admin check and ordering against
     * ledger mutations go through {@code CollateralEngine.setParam}.
     */
    public synchronized void setParam(ParamType type, BigDecimal value) {
        validate(type, value);
        Snapshot s = snapshot;
        snapshot = switch (type) {
            case MINT_FEE_BPS -> new Snapshot(value.intValueExact(), s.redeemFeeBps(), s.bondFloorPrice(),
                    s.maxBondRate(), s.deviationToleranceBps());
            case REDEEM_FEE_BPS -> new Snapshot(s.mintFeeBps(), value.intValueExact(), s.bondFloorPrice(),
                    s.maxBondRate(), s.deviationToleranceBps());
            case BOND_FLOOR_PRICE -> new Snapshot(s.mintFeeBps(), s.redeemFeeBps(), FixedPoint.of(value),
                    s.maxBondRate(), s.deviationToleranceBps());
            case MAX_BOND_RATE -> new Snapshot(s.mintFeeBps(), s.redeemFeeBps(), s.bondFloorPrice(),
                    value.intValueExact(), s.deviationToleranceBps());
            case DEVIATION_TOLERANCE_BPS -> new Snapshot(s.mintFeeBps(), s.redeemFeeBps(), s.bondFloorPrice(),
                    s.maxBondRate(), value.intValueExact());
        };
        log.info("Governance parameter {} set to {}", type, value.toPlainString());
    }

    public Map<ParamType, BigDecimal> all() {
        Snapshot s = snapshot;
        Map<ParamType, BigDecimal> values = new EnumMap<>(ParamType.class);
        for (ParamType type : ParamType.values()) {
            values.put(type, s.get(type));
        }
        return values;
    }

    private static void validate(ParamType type, BigDecimal value) {
        if (value == null) {
            throw new InvalidParameterException(type, type + " is required");
        }
        if (type != ParamType.BOND_FLOOR_PRICE && value.stripTrailingZeros().scale() > 0) {
            throw new InvalidParameterException(type, type + " must be a whole number of basis points");
        }
        boolean ok = switch (type) {
            case MINT_FEE_BPS, REDEEM_FEE_BPS -> inRange(value, 0, MAX_FEE_BPS);
            case DEVIATION_TOLERANCE_BPS -> inRange(value, 1, MAX_TOLERANCE_BPS);
            case MAX_BOND_RATE -> inRange(value, 0, MAX_BOND_RATE_BPS);
            case BOND_FLOOR_PRICE -> value.signum() > 0 && value.compareTo(BigDecimal.ONE) <= 0;
        };
        if (!ok) {
            throw new InvalidParameterException(type, type + " out of range: " + value.toPlainString());
        }
    }

    private static boolean inRange(BigDecimal value, int min, int max) {
        return value.compareTo(BigDecimal.valueOf(min)) >= 0 && value.compareTo(BigDecimal.valueOf(max)) <= 0;
    }

    private record Snapshot(int mintFeeBps, int redeemFeeBps, BigDecimal bondFloorPrice, int maxBondRate,
                            int deviationToleranceBps) implements GovernanceParameters {

        BigDecimal get(ParamType type) {
            return switch (type) {
                case MINT_FEE_BPS -> BigDecimal.valueOf(mintFeeBps);
                case REDEEM_FEE_BPS -> BigDecimal.valueOf(redeemFeeBps);
                case BOND_FLOOR_PRICE -> bondFloorPrice;
                case MAX_BOND_RATE -> BigDecimal.valueOf(maxBondRate);
                case DEVIATION_TOLERANCE_BPS -> BigDecimal.valueOf(deviationToleranceBps);
            };
        }
    }
}
