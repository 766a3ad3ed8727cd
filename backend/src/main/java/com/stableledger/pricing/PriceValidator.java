package com.stableledger.pricing;

import com.stableledger.common.FixedPoint;
import com.stableledger.domain.AssetId;
import com.stableledger.domain.GovernanceParameters;
import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;
import com.stableledger.domain.TrustedPrice;
import com.stableledger.pricing.config.PricingProperties;
import com.stableledger.pricing.config.PricingProperties.QuoteDenomination;
import com.stableledger.pricing.config.PricingProperties.RouteProperties;
import com.stableledger.pricing.twap.TimeWeightedPriceOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

/**
 * One trusted USD price per asset: the pool TWAP, corroborated by the median of the route's push feeds.
 * Any missing or stale input, or a deviation beyond tolerance, fails the request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceValidator {

    private final PricingProperties pricingProperties;
    private final TimeWeightedPriceOracle oracle;
    private final PriceFeedAdapter priceFeedAdapter;
    private final UnitOfAccountIndex unitOfAccountIndex;
    private final GovernanceParameters governanceParameters;
    private final Clock clock;

    public TrustedPrice getTrustedPrice(AssetId asset) {
        RouteProperties route = pricingProperties.getRoutes().get(asset);
        if (route == null || route.getPairId() == null) {
            throw new LedgerException(LedgerErrorCode.PRICE_UNAVAILABLE, "No price route for " + asset);
        }
        BigDecimal poolPrice = oracle.priceInUnits(route.getPairId(), route.getBaseDecimals(), route.getQuoteDecimals());
        if (route.getQuote() == QuoteDenomination.UNIT_OF_ACCOUNT) {
            poolPrice = FixedPoint.mul(poolPrice, unitOfAccountIndex.current());
        }
        if (!route.getFeeds().isEmpty()) {
            List<BigDecimal> readings = route.getFeeds().stream()
                    .map(feedId -> priceFeedAdapter.read(feedId).value())
                    .toList();
            checkDeviation(asset, poolPrice, median(readings));
        }
        return new TrustedPrice(asset, poolPrice, clock.instant());
    }

    /** USD value of one unit of account. */
    public BigDecimal unitOfAccountPrice() {
        return unitOfAccountIndex.current();
    }

    private void checkDeviation(AssetId asset, BigDecimal poolPrice, BigDecimal reference) {
        int toleranceBps = governanceParameters.deviationToleranceBps();
        BigDecimal deviationScaled = poolPrice.subtract(reference).abs().multiply(FixedPoint.BPS_DENOMINATOR);
        if (deviationScaled.compareTo(reference.multiply(BigDecimal.valueOf(toleranceBps))) > 0) {
            log.warn("Price deviation for {}: pool {} vs reference {} (tolerance {} bps)",
                    asset, poolPrice.toPlainString(), reference.toPlainString(), toleranceBps);
            throw new LedgerException(LedgerErrorCode.PRICE_DEVIATION,
                    "Pool price for " + asset + " deviates from feeds beyond " + toleranceBps + " bps");
        }
    }

    static BigDecimal median(List<BigDecimal> values) {
        List<BigDecimal> sorted = values.stream().sorted().toList();
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return FixedPoint.div(sorted.get(mid - 1).add(sorted.get(mid)), BigDecimal.valueOf(2));
    }
}
