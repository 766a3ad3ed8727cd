package com.stableledger.pricing.config;

import com.stableledger.domain.AssetId;
import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pricing module configuration. Documented in application.yml under stableledger.pricing.
 */
@ConfigurationProperties(prefix = "stableledger.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * A push reading older than this is treated as unavailable.
     */
    private long maxFeedAgeSeconds = 3_600;

    /**
     * CoinGecko API base URL (free: https://api.coingecko.com/api/v3).
     */
    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /**
     * Token bucket: CoinGecko requests per minute across all COINGECKO feeds.
     */
    private int coingeckoRequestsPerMinute = 30;

    /**
     * How long a caller waits for a CoinGecko permit before the feed reports unavailable.
     */
    private long coingeckoLimiterTimeoutMs = 0;

    /**
     * Price route per tracked asset. An asset without a route has no trusted price.
     */
    private Map<AssetId, RouteProperties> routes = new EnumMap<>(AssetId.class);

    /**
     * Push feeds by id, referenced from routes and from the unit-of-account index.
     */
    private Map<String, FeedProperties> feeds = new LinkedHashMap<>();

    private UnitOfAccountProperties unitOfAccount = new UnitOfAccountProperties();

    public enum QuoteDenomination {
        /** Pool quote asset is a USD token; the pool price is already in USD. */
        USD,
        /** Pool quote asset is Stable; the pool price is scaled by the unit-of-account value. */
        UNIT_OF_ACCOUNT
    }

    public enum FeedType {
        CONFIGURED,
        /** Product of two other feeds (e.g. BTC/USD × WBTC/BTC). */
        PRODUCT,
        COINGECKO
    }

    @Getter
    @Setter
    public static class RouteProperties {
        /** Pool whose TWAP prices the asset; the asset is token0. */
        private String pairId;
        private int baseDecimals = 18;
        private int quoteDecimals = 18;
        private QuoteDenomination quote = QuoteDenomination.USD;
        /** Corroborating feeds. Empty means the TWAP alone is trusted. */
        private List<String> feeds = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class FeedProperties {
        private FeedType type = FeedType.CONFIGURED;
        /** CONFIGURED: seed price. */
        private BigDecimal price;
        /** CONFIGURED: implied decimals of the published answer. */
        private int decimals = 8;
        /** CONFIGURED: report the read time as asOf, i.e. a feed that never goes stale. */
        private boolean attestOnRead = true;
        /** PRODUCT: the two feed ids multiplied together. */
        private List<String> components = new ArrayList<>();
        /** COINGECKO: coin id, e.g. "bitcoin". */
        private String coinId;
    }

    @Getter
    @Setter
    public static class UnitOfAccountProperties {
        /** Value of one unit of account in USD before the first index refresh. */
        private BigDecimal initialValue = BigDecimal.ONE;
        /** Feed publishing the PCE price index. Blank disables indexing. */
        private String pceFeedId = "pce";
        /** Index updates kept in memory. */
        private int historySize = 64;
    }
}
