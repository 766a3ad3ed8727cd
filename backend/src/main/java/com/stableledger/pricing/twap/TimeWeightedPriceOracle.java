package com.stableledger.pricing.twap;

import com.stableledger.common.LedgerSerializer;
import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;
import com.stableledger.domain.LiquidityPool;
import com.stableledger.domain.LiquidityPoolRegistry;
import com.stableledger.domain.PairObservation;
import com.stableledger.domain.PairObservation.Observation;
import com.stableledger.domain.PairObservationRepository;
import com.stableledger.domain.PoolReserves;
import com.stableledger.domain.PoolState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Time-weighted average price per pair from a pool's cumulative price accumulator, with two
 * observation slots. The average always runs from the reference observation to now, so a trade
 * placed right before a read carries only the weight of the seconds it has been live.
 * <p>
 * Raw prices are UQ112x112: price of token0 in token1 native units, times 2^112.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimeWeightedPriceOracle {

    public static final Duration PERIOD = Duration.ofMinutes(30);
    static final int RESOLUTION = 112;
    static final BigInteger Q112 = BigInteger.ONE.shiftLeft(RESOLUTION);
    private static final int PRICE_DECIMALS = 18;

    private final LiquidityPoolRegistry pools;
    private final PairObservationRepository observationRepository;
    private final LedgerSerializer serializer;
    private final Clock clock;

    /**
     * Stores the live accumulator when the pair has no observation or the newer one is at least
     * {@link #PERIOD} old. Otherwise does nothing.
     *
     * @return true when an observation was written
     */
    public boolean recordObservationIfDue(String pairId) {
        LiquidityPool pool = pools.require(pairId);
        return serializer.execute(() -> {
            long now = nowSeconds();
            Optional<PairObservation> existing = observationRepository.findById(pairId);
            if (existing.isPresent() && !isDue(existing.get(), now)) {
                log.debug("Observation for {} not due", pairId);
                return false;
            }
            Observation candidate = new Observation(now, currentCumulative(pool, now));
            PairObservation slots = existing.orElseGet(() -> new PairObservation(pairId, null));
            slots.shift(candidate);
            observationRepository.save(slots);
            log.info("Recorded observation for {} at {}", pairId, now);
            return true;
        });
    }

    public boolean needsUpdate(String pairId) {
        pools.require(pairId);
        return observationRepository.findById(pairId)
                .map(slots -> isDue(slots, nowSeconds()))
                .orElse(true);
    }

    public boolean isReady(String pairId) {
        pools.require(pairId);
        return observationRepository.findById(pairId)
                .flatMap(slots -> reference(slots, nowSeconds()))
                .isPresent();
    }

    /**
     * Average raw (UQ112x112) price from the reference observation to now.
     *
     * @throws LedgerException OBSERVATION_NOT_READY when no observation is at least {@link #PERIOD} old
     */
    public BigInteger computeAverage(String pairId) {
        LiquidityPool pool = pools.require(pairId);
        long now = nowSeconds();
        Observation reference = observationRepository.findById(pairId)
                .flatMap(slots -> reference(slots, now))
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.OBSERVATION_NOT_READY,
                        "No observation for " + pairId + " is " + PERIOD.toMinutes() + " minutes old yet"));
        BigInteger elapsed = BigInteger.valueOf(now - reference.timestamp());
        return currentCumulative(pool, now).subtract(reference.accumulator()).divide(elapsed);
    }

    /**
     * Average price of token0 in token1 as an 18-decimal value, given both assets' native decimals.
     */
    public BigDecimal priceInUnits(String pairId, int decimalsA, int decimalsB) {
        BigInteger raw = computeAverage(pairId);
        BigInteger numerator = raw.multiply(BigInteger.TEN.pow(decimalsA)).multiply(BigInteger.TEN.pow(PRICE_DECIMALS));
        BigInteger denominator = Q112.multiply(BigInteger.TEN.pow(decimalsB));
        return new BigDecimal(numerator.divide(denominator), PRICE_DECIMALS);
    }

    public ObservationInfo observationInfo(String pairId) {
        pools.require(pairId);
        long now = nowSeconds();
        Optional<PairObservation> slots = observationRepository.findById(pairId);
        Observation older = slots.map(PairObservation::getOlder).orElse(null);
        Observation newer = slots.map(PairObservation::getNewer).orElse(null);
        return new ObservationInfo(
                pairId,
                older != null ? older.timestamp() : null,
                newer != null ? newer.timestamp() : null,
                newer != null ? now - newer.timestamp() : null,
                slots.flatMap(s -> reference(s, now)).isPresent(),
                slots.map(s -> isDue(s, now)).orElse(true));
    }

    /**
     * Accumulator as of {@code now}: the stored value plus spot × seconds since the pool last synced.
     */
    static BigInteger currentCumulative(LiquidityPool pool, long now) {
        PoolState state = pool.state();
        BigInteger cumulative = state.cumulativePriceAccumulator();
        PoolReserves reserves = state.reserves();
        long lastSync = reserves.blockTimestampLast();
        if (now > lastSync && reserves.reserve0().signum() > 0 && reserves.reserve1().signum() > 0) {
            BigInteger spot = reserves.reserve1().shiftLeft(RESOLUTION).divide(reserves.reserve0());
            cumulative = cumulative.add(spot.multiply(BigInteger.valueOf(now - lastSync)));
        }
        return cumulative;
    }

    private static boolean isDue(PairObservation slots, long now) {
        return slots.getNewer() == null || now - slots.getNewer().timestamp() >= PERIOD.getSeconds();
    }

    private static Optional<Observation> reference(PairObservation slots, long now) {
        long period = PERIOD.getSeconds();
        if (slots.getNewer() != null && now - slots.getNewer().timestamp() >= period) {
            return Optional.of(slots.getNewer());
        }
        if (slots.getOlder() != null && now - slots.getOlder().timestamp() >= period) {
            return Optional.of(slots.getOlder());
        }
        return Optional.empty();
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }
}
