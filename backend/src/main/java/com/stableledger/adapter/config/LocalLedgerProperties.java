package com.stableledger.adapter.config;

import com.stableledger.domain.AssetId;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory collaborators of a local deployment. Documented in application.yml under stableledger.local.
 */
@ConfigurationProperties(prefix = "stableledger.local")
@Getter
@Setter
public class LocalLedgerProperties {

    /**
     * Native decimals per token. Reserve mirrors WBTC (8); the others default to 18.
     */
    private Map<AssetId, Integer> tokenDecimals = new EnumMap<>(Map.of(
            AssetId.RESERVE, 8,
            AssetId.STABLE, 18,
            AssetId.BOND, 18,
            AssetId.BACKSTOP, 18));

    /**
     * Pools by pair id, seeded with decimal reserves.
     */
    private Map<String, PoolProperties> pools = new LinkedHashMap<>();

    /**
     * Balances minted at startup: asset -> account -> amount.
     */
    private Map<AssetId, Map<String, BigDecimal>> genesisBalances = new EnumMap<>(AssetId.class);

    @Getter
    @Setter
    public static class PoolProperties {
        private int decimals0 = 18;
        private int decimals1 = 18;
        private BigDecimal reserve0 = BigDecimal.ZERO;
        private BigDecimal reserve1 = BigDecimal.ZERO;
    }
}
