package com.stableledger.pricing.feed;

import com.stableledger.domain.FeedReading;
import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import org.springframework.cache.concurrent.ConcurrentMapCache;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.math.BigInteger;
import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoinGeckoPriceFeedTest {

    private static final String BODY = "{\"bitcoin\": {\"usd\": 64250.5, \"last_updated_at\": 1714521600},"
            + " \"ethereum\": {\"usd\": 3100, \"last_updated_at\": 1714521600}}";

    private AtomicInteger calls;
    private WebClient.Builder webClientBuilder;
    private RateLimiter rateLimiter;
    private ConcurrentMapCache cache;

    @BeforeEach
    void setUp() {
        calls = new AtomicInteger();
        webClientBuilder = WebClient.builder()
                .exchangeFunction(req -> {
                    calls.incrementAndGet();
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header("Content-Type", "application/json")
                            .body(BODY)
                            .build());
                });
        rateLimiter = RateLimiter.of("coingecko-test", RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        cache = new ConcurrentMapCache("coingeckoPriceCache");
    }

    @Test
    @DisplayName("parseReading scales usd to 18 decimals and keeps last_updated_at")
    void parseReading() {
        Optional<FeedReading> reading = CoinGeckoPriceFeed.parseReading(BODY, "bitcoin");

        assertThat(reading).isPresent();
        assertThat(reading.get().answer()).isEqualTo(new BigInteger("64250500000000000000000"));
        assertThat(reading.get().decimals()).isEqualTo(18);
        assertThat(reading.get().asOf()).isEqualTo(Instant.ofEpochSecond(1714521600L));
    }

    @Test
    @DisplayName("parseReading is empty for missing coin or malformed body")
    void parseReadingEmpty() {
        assertThat(CoinGeckoPriceFeed.parseReading(BODY, "dogecoin")).isEmpty();
        assertThat(CoinGeckoPriceFeed.parseReading("not json", "bitcoin")).isEmpty();
        assertThat(CoinGeckoPriceFeed.parseReading(null, "bitcoin")).isEmpty();
    }

    @Test
    @DisplayName("second read of the same coin is served from cache")
    void cachedRead() {
        CoinGeckoPriceFeed feed = new CoinGeckoPriceFeed("btc", "bitcoin", "https://cg.test/api/v3",
                webClientBuilder, rateLimiter, cache);

        FeedReading first = feed.latestPrice();
        FeedReading second = feed.latestPrice();

        assertThat(second).isEqualTo(first);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("request denied by the rate limiter reports the price unavailable")
    void rateLimited() {
        new CoinGeckoPriceFeed("btc", "bitcoin", "https://cg.test/api/v3", webClientBuilder, rateLimiter, cache)
                .latestPrice();
        CoinGeckoPriceFeed eth = new CoinGeckoPriceFeed("eth", "ethereum", "https://cg.test/api/v3",
                webClientBuilder, rateLimiter, cache);

        assertThatThrownBy(eth::latestPrice)
                .isInstanceOf(LedgerException.class)
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode())
                        .isEqualTo(LedgerErrorCode.PRICE_UNAVAILABLE));
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("connection refused reports the price unavailable and caches nothing")
    void connectionRefused() {
        WebClient.Builder refusing = WebClient.builder()
                .exchangeFunction(req -> Mono.error(new WebClientRequestException(
                        new ConnectException("Connection refused"), HttpMethod.GET,
                        URI.create("https://cg.test/api/v3/simple/price"), new HttpHeaders())));
        CoinGeckoPriceFeed feed = new CoinGeckoPriceFeed("btc", "bitcoin", "https://cg.test/api/v3",
                refusing, rateLimiter, cache);

        assertThatThrownBy(feed::latestPrice)
                .isInstanceOf(LedgerException.class)
                .hasCauseInstanceOf(WebClientRequestException.class)
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode())
                        .isEqualTo(LedgerErrorCode.PRICE_UNAVAILABLE));
        assertThat(cache.get("bitcoin")).isNull();
    }
}
