package com.stableledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Global collateral accounting, one document per protocol instance. Written only by CollateralEngine.
 * Transitions return a new instance; the caller saves it once the whole request has succeeded.
 */
@Document(collection = "collateral_positions")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CollateralPosition {

    public static final String GLOBAL_ID = "global";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    /** Reserve asset held as collateral, reserve decimals. */
    private BigDecimal totalReserveUnits;
    /** Stable issued by the engine and not yet redeemed, 18 decimals. */
    private BigDecimal totalStableSupplyTracked;
    private Instant updatedAt;
    @Version
    private Long version;

    public static CollateralPosition empty() {
        CollateralPosition p = new CollateralPosition();
        p.setId(GLOBAL_ID);
        p.setTotalReserveUnits(BigDecimal.ZERO);
        p.setTotalStableSupplyTracked(BigDecimal.ZERO);
        return p;
    }

    public CollateralPosition afterMint(BigDecimal reserveIn, BigDecimal stableIssued, Instant at) {
        return with(totalReserveUnits.add(reserveIn), totalStableSupplyTracked.add(stableIssued), at);
    }

    public CollateralPosition afterRedeem(BigDecimal reserveOut, BigDecimal stableRedeemed, Instant at) {
        return with(totalReserveUnits.subtract(reserveOut), totalStableSupplyTracked.subtract(stableRedeemed), at);
    }

    public CollateralPosition afterBondRedemption(BigDecimal stableIssued, Instant at) {
        return with(totalReserveUnits, totalStableSupplyTracked.add(stableIssued), at);
    }

    private CollateralPosition with(BigDecimal reserve, BigDecimal supply, Instant at) {
        if (reserve.signum() < 0) {
            throw new LedgerException(LedgerErrorCode.INSUFFICIENT_FUNDS,
                    "Reserve units would go negative: " + reserve.toPlainString());
        }
        if (supply.signum() < 0) {
            throw new LedgerException(LedgerErrorCode.INSUFFICIENT_FUNDS,
                    "Tracked stable supply would go negative: " + supply.toPlainString());
        }
        CollateralPosition next = new CollateralPosition();
        next.setId(id);
        next.setVersion(version);
        next.setTotalReserveUnits(reserve);
        next.setTotalStableSupplyTracked(supply);
        next.setUpdatedAt(at);
        return next;
    }
}
