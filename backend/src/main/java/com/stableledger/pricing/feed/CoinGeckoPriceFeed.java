package com.stableledger.pricing.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stableledger.domain.FeedReading;
import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;
import com.stableledger.domain.PriceFeed;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;

/**
 * USD price from CoinGecko /simple/price. Throttled by the shared CoinGecko rate limiter and
 * cached per coin id for a short TTL.
 */
@Slf4j
public class CoinGeckoPriceFeed implements PriceFeed {

    private static final int DECIMALS = 18;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String feedId;
    private final String coinId;
    private final String baseUrl;
    private final WebClient.Builder webClientBuilder;
    private final RateLimiter rateLimiter;
    private final Cache cache;

    public CoinGeckoPriceFeed(String feedId, String coinId, String baseUrl, WebClient.Builder webClientBuilder,
                              RateLimiter rateLimiter, Cache cache) {
        this.feedId = feedId;
        this.coinId = coinId;
        this.baseUrl = baseUrl;
        this.webClientBuilder = webClientBuilder;
        this.rateLimiter = rateLimiter;
        this.cache = cache;
    }

    @Override
    public String feedId() {
        return feedId;
    }

    @Override
    public FeedReading latestPrice() {
        FeedReading cached = cache.get(coinId, FeedReading.class);
        if (cached != null) {
            return cached;
        }
        if (!rateLimiter.acquirePermission()) {
            throw new LedgerException(LedgerErrorCode.PRICE_UNAVAILABLE, "CoinGecko rate limit reached for " + coinId);
        }
        String url = baseUrl + "/simple/price?ids=" + coinId + "&vs_currencies=usd&include_last_updated_at=true";
        String response;
        try {
            response = webClientBuilder.build().get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (WebClientException e) {
            log.warn("CoinGecko simple/price failed for {}: {}", coinId, e.getMessage());
            throw new LedgerException(LedgerErrorCode.PRICE_UNAVAILABLE, "CoinGecko request failed for " + coinId, e);
        }
        FeedReading reading = parseReading(response, coinId)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.PRICE_UNAVAILABLE,
                        "CoinGecko returned no usd price for " + coinId));
        cache.put(coinId, reading);
        return reading;
    }

    static Optional<FeedReading> parseReading(String json, String coinId) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode coin = MAPPER.readTree(json).path(coinId);
            JsonNode usd = coin.path("usd");
            JsonNode updatedAt = coin.path("last_updated_at");
            if (!usd.isNumber() || !updatedAt.canConvertToLong()) {
                return Optional.empty();
            }
            BigInteger answer = usd.decimalValue().movePointRight(DECIMALS)
                    .setScale(0, RoundingMode.FLOOR).toBigIntegerExact();
            return Optional.of(new FeedReading(answer, DECIMALS, Instant.ofEpochSecond(updatedAt.asLong())));
        } catch (Exception e) {
            log.debug("Unparseable CoinGecko body for {}", coinId, e);
            return Optional.empty();
        }
    }
}
