package com.stableledger.pricing.config;

import com.stableledger.config.CaffeineConfig;
import com.stableledger.domain.PriceFeed;
import com.stableledger.domain.PriceFeedRegistry;
import com.stableledger.pricing.config.PricingProperties.FeedProperties;
import com.stableledger.pricing.config.PricingProperties.FeedType;
import com.stableledger.pricing.feed.CoinGeckoPriceFeed;
import com.stableledger.pricing.feed.ConfiguredPriceFeed;
import com.stableledger.pricing.feed.ProductPriceFeed;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pricing module configuration: properties, push feeds built from stableledger.pricing.feeds and the
 * shared CoinGecko rate limiter and cache.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    @Bean(name = "coingeckoRateLimiter")
    public RateLimiter coingeckoRateLimiter(PricingProperties pricingProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, pricingProperties.getCoingeckoRequestsPerMinute()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, pricingProperties.getCoingeckoLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("coingecko", config);
    }

    @Bean
    public PriceFeedRegistry priceFeedRegistry(PricingProperties pricingProperties,
                                               Clock clock,
                                               WebClient.Builder webClientBuilder,
                                               RateLimiter coingeckoRateLimiter,
                                               CacheManager cacheManager) {
        Cache coingeckoCache = cacheManager.getCache(CaffeineConfig.COINGECKO_PRICE_CACHE);
        Map<String, PriceFeed> built = new LinkedHashMap<>();
        pricingProperties.getFeeds().forEach((feedId, feed) -> {
            if (feed.getType() == FeedType.CONFIGURED) {
                built.put(feedId, configured(feedId, feed, clock));
            } else if (feed.getType() == FeedType.COINGECKO) {
                built.put(feedId, new CoinGeckoPriceFeed(feedId, feed.getCoinId(), pricingProperties.getCoingeckoBaseUrl(),
                        webClientBuilder, coingeckoRateLimiter, coingeckoCache));
            }
        });
        pricingProperties.getFeeds().forEach((feedId, feed) -> {
            if (feed.getType() == FeedType.PRODUCT) {
                built.put(feedId, product(feedId, feed, built));
            }
        });
        return new PriceFeedRegistry(built.values());
    }

    private static ConfiguredPriceFeed configured(String feedId, FeedProperties feed, Clock clock) {
        ConfiguredPriceFeed configured = new ConfiguredPriceFeed(feedId, feed.getDecimals(), feed.isAttestOnRead(), clock);
        if (feed.getPrice() != null) {
            configured.set(feed.getPrice());
        }
        return configured;
    }

    private static ProductPriceFeed product(String feedId, FeedProperties feed, Map<String, PriceFeed> built) {
        if (feed.getComponents().size() != 2) {
            throw new IllegalStateException("Product feed " + feedId + " needs exactly two components");
        }
        PriceFeed first = built.get(feed.getComponents().get(0));
        PriceFeed second = built.get(feed.getComponents().get(1));
        if (first == null || second == null) {
            throw new IllegalStateException("Product feed " + feedId + " references unknown feed " + feed.getComponents());
        }
        return new ProductPriceFeed(feedId, first, second);
    }
}
