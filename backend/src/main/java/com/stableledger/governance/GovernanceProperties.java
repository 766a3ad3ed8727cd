package com.stableledger.governance;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Initial governable parameters. Documented in application.yml under stableledger.governance.
 */
@ConfigurationProperties(prefix = "stableledger.governance")
@Getter
@Setter
public class GovernanceProperties {

    /** Fee on mint in basis points, minted to the vault. */
    private int mintFeeBps = 50;

    /** Fee on redeem in basis points, kept by the vault. */
    private int redeemFeeBps = 50;

    /** Minimum Bond price in units of account used when paying a shortfall. */
    private BigDecimal bondFloorPrice = new BigDecimal("0.98");

    /** Bond-staking emission cap in basis points. */
    private int maxBondRate = 500;

    /** Allowed pool vs feed deviation in basis points. */
    private int deviationToleranceBps = 100;
}
