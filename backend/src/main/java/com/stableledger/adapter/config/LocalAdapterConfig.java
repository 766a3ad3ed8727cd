package com.stableledger.adapter.config;

import com.stableledger.adapter.pool.ConstantProductPool;
import com.stableledger.adapter.token.InMemoryTokenLedger;
import com.stableledger.adapter.token.LocalTokenLedgers;
import com.stableledger.collateral.config.CollateralProperties;
import com.stableledger.domain.AssetId;
import com.stableledger.domain.LiquidityPoolRegistry;
import com.stableledger.domain.TokenLedgerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wires in-memory token ledgers and constant-product pools as the protocol's collaborators.
 */
@Configuration
@EnableConfigurationProperties(LocalLedgerProperties.class)
@Slf4j
public class LocalAdapterConfig {

    @Bean
    public LocalTokenLedgers localTokenLedgers(LocalLedgerProperties properties,
                                               CollateralProperties collateralProperties) {
        List<InMemoryTokenLedger> ledgers = new ArrayList<>();
        for (AssetId asset : AssetId.values()) {
            int decimals = properties.getTokenDecimals().getOrDefault(asset, 18);
            InMemoryTokenLedger ledger = new InMemoryTokenLedger(asset, decimals, collateralProperties.getVaultAccount());
            Map<String, BigDecimal> genesis = properties.getGenesisBalances().getOrDefault(asset, Map.of());
            genesis.forEach((account, amount) -> {
                if (amount.signum() > 0) {
                    ledger.mint(account, amount);
                }
            });
            if (!genesis.isEmpty()) {
                log.info("Local {} ledger seeded for {} accounts", asset, genesis.size());
            }
            ledgers.add(ledger);
        }
        return new LocalTokenLedgers(ledgers);
    }

    @Bean
    public TokenLedgerRegistry tokenLedgerRegistry(LocalTokenLedgers localTokenLedgers) {
        return new TokenLedgerRegistry(localTokenLedgers.all());
    }

    @Bean
    public LiquidityPoolRegistry liquidityPoolRegistry(LocalLedgerProperties properties, Clock clock) {
        List<ConstantProductPool> pools = new ArrayList<>();
        properties.getPools().forEach((pairId, p) -> {
            ConstantProductPool pool = new ConstantProductPool(pairId, p.getDecimals0(), p.getDecimals1(), clock);
            pool.setReserves(p.getReserve0(), p.getReserve1());
            pools.add(pool);
        });
        return new LiquidityPoolRegistry(pools);
    }
}
