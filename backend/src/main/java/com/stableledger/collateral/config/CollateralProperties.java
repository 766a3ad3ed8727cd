package com.stableledger.collateral.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Accounts the collateral module acts as. Documented in application.yml under stableledger.collateral.
 */
@ConfigurationProperties(prefix = "stableledger.collateral")
@Getter
@Setter
public class CollateralProperties {

    /** Identity the engine presents to the vault. The vault rejects every other caller. */
    private String engineAccount = "collateral-engine";

    /** Custody account of the reserve vault on every token ledger. */
    private String vaultAccount = "reserve-vault";

    /** Initial administrator (pause, admin transfer, parameter writes). */
    private String adminAccount = "admin";
}
