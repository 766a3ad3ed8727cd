package com.stableledger.adapter.pool;

import com.stableledger.domain.LiquidityPool;
import com.stableledger.domain.PoolReserves;
import com.stableledger.domain.PoolState;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;

/**
 * x·y=k pool with a 0.3% swap fee. Before every reserve change the price of token0 in token1
 * (UQ112x112) is accumulated over the seconds the old reserves were live.
 */
@Slf4j
public class ConstantProductPool implements LiquidityPool {

    private static final int RESOLUTION = 112;
    private static final BigInteger FEE_NUMERATOR = BigInteger.valueOf(997);
    private static final BigInteger FEE_DENOMINATOR = BigInteger.valueOf(1000);

    private final String pairId;
    private final int decimals0;
    private final int decimals1;
    private final Clock clock;

    private BigInteger reserve0 = BigInteger.ZERO;
    private BigInteger reserve1 = BigInteger.ZERO;
    private BigInteger price0CumulativeLast = BigInteger.ZERO;
    private long blockTimestampLast;

    public ConstantProductPool(String pairId, int decimals0, int decimals1, Clock clock) {
        this.pairId = pairId;
        this.decimals0 = decimals0;
        this.decimals1 = decimals1;
        this.clock = clock;
        this.blockTimestampLast = clock.instant().getEpochSecond();
    }

    @Override
    public String pairId() {
        return pairId;
    }

    @Override
    public synchronized BigInteger cumulativePriceAccumulator() {
        return price0CumulativeLast;
    }

    @Override
    public synchronized PoolReserves reserves() {
        return new PoolReserves(reserve0, reserve1, blockTimestampLast);
    }

    @Override
    public synchronized long lastSyncTime() {
        return blockTimestampLast;
    }

    @Override
    public synchronized PoolState state() {
        return new PoolState(price0CumulativeLast, new PoolReserves(reserve0, reserve1, blockTimestampLast));
    }

    /** Replaces both reserves (raw native units), e.g. after liquidity is added or removed. */
    public synchronized void setReserves(BigInteger newReserve0, BigInteger newReserve1) {
        if (newReserve0.signum() < 0 || newReserve1.signum() < 0) {
            throw new IllegalArgumentException("Reserves must not be negative");
        }
        update(newReserve0, newReserve1);
    }

    /** Sets reserves from decimal amounts of each token. */
    public void setReserves(BigDecimal amount0, BigDecimal amount1) {
        setReserves(toRaw(amount0, decimals0), toRaw(amount1, decimals1));
    }

    /** Accrues the accumulator up to now without changing reserves. */
    public synchronized void sync() {
        update(reserve0, reserve1);
    }

    /** Sells {@code amountIn} raw token0 into the pool; returns the raw token1 paid out. */
    public synchronized BigInteger swapExactToken0ForToken1(BigInteger amountIn) {
        BigInteger out = amountOut(amountIn, reserve0, reserve1);
        update(reserve0.add(amountIn), reserve1.subtract(out));
        log.debug("Swap on {}: {} token0 in, {} token1 out", pairId, amountIn, out);
        return out;
    }

    /** Sells {@code amountIn} raw token1 into the pool; returns the raw token0 paid out. */
    public synchronized BigInteger swapExactToken1ForToken0(BigInteger amountIn) {
        BigInteger out = amountOut(amountIn, reserve1, reserve0);
        update(reserve0.subtract(out), reserve1.add(amountIn));
        log.debug("Swap on {}: {} token1 in, {} token0 out", pairId, amountIn, out);
        return out;
    }

    /** Instantaneous price of token0 in token1, 18 decimals. */
    public synchronized BigDecimal spotPrice() {
        if (reserve0.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal amount0 = new BigDecimal(reserve0, decimals0);
        BigDecimal amount1 = new BigDecimal(reserve1, decimals1);
        return amount1.divide(amount0, 18, RoundingMode.FLOOR);
    }

    private void update(BigInteger newReserve0, BigInteger newReserve1) {
        long now = clock.instant().getEpochSecond();
        long elapsed = now - blockTimestampLast;
        if (elapsed > 0 && reserve0.signum() > 0 && reserve1.signum() > 0) {
            BigInteger price0 = reserve1.shiftLeft(RESOLUTION).divide(reserve0);
            price0CumulativeLast = price0CumulativeLast.add(price0.multiply(BigInteger.valueOf(elapsed)));
        }
        reserve0 = newReserve0;
        reserve1 = newReserve1;
        blockTimestampLast = Math.max(blockTimestampLast, now);
    }

    private static BigInteger amountOut(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut) {
        if (amountIn.signum() <= 0) {
            throw new IllegalArgumentException("Swap amount must be positive");
        }
        if (reserveIn.signum() == 0 || reserveOut.signum() == 0) {
            throw new IllegalStateException("Pool has no liquidity");
        }
        BigInteger amountInWithFee = amountIn.multiply(FEE_NUMERATOR);
        return amountInWithFee.multiply(reserveOut)
                .divide(reserveIn.multiply(FEE_DENOMINATOR).add(amountInWithFee));
    }

    private static BigInteger toRaw(BigDecimal amount, int decimals) {
        return amount.movePointRight(decimals).setScale(0, RoundingMode.FLOOR).toBigIntegerExact();
    }
}
