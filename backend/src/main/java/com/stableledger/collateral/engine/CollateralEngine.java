package com.stableledger.collateral.engine;

import com.stableledger.collateral.config.CollateralProperties;
import com.stableledger.collateral.vault.ReserveVault;
import com.stableledger.common.FixedPoint;
import com.stableledger.common.LedgerSerializer;
import com.stableledger.domain.AssetId;
import com.stableledger.domain.CollateralPosition;
import com.stableledger.domain.CollateralPositionRepository;
import com.stableledger.domain.GovernanceParameters;
import com.stableledger.domain.LedgerErrorCode;
import com.stableledger.domain.LedgerException;
import com.stableledger.domain.TokenLedger;
import com.stableledger.domain.TokenLedgerRegistry;
import com.stableledger.governance.GovernanceParameterStore;
import com.stableledger.governance.ParamType;
import com.stableledger.pricing.PriceValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Map;
import java.util.function.Function;

/**
 * Mint and redemption state machine. Sole writer of {@link CollateralPosition}.
 * <p>
 * Every mutating call runs on the {@link LedgerSerializer} inside the reentrancy guard. Token ledger
 * effects are journaled; if any step fails they are reverted and the position is not saved.
 */
@Service
@Slf4j
public class CollateralEngine {

    private final CollateralPositionRepository positionRepository;
    private final PriceValidator priceValidator;
    private final ReserveVault reserveVault;
    private final TokenLedgerRegistry ledgers;
    private final GovernanceParameterStore governance;
    private final LedgerSerializer serializer;
    private final CollateralProperties collateralProperties;
    private final Clock clock;

    private final ReentrancyGuard guard = new ReentrancyGuard();
    private final AdminRole adminRole;
    private volatile boolean paused;

    public CollateralEngine(CollateralPositionRepository positionRepository,
                            PriceValidator priceValidator,
                            ReserveVault reserveVault,
                            TokenLedgerRegistry ledgers,
                            GovernanceParameterStore governance,
                            LedgerSerializer serializer,
                            CollateralProperties collateralProperties,
                            Clock clock) {
        this.positionRepository = positionRepository;
        this.priceValidator = priceValidator;
        this.reserveVault = reserveVault;
        this.ledgers = ledgers;
        this.governance = governance;
        this.serializer = serializer;
        this.collateralProperties = collateralProperties;
        this.clock = clock;
        this.adminRole = new AdminRole(collateralProperties.getAdminAccount());
    }

    /**
     * Locks {@code reserveAmount} in the vault and mints Stable at the trusted reserve price.
     * The mint fee is minted to the vault; the rest goes to the caller.
     */
    public MintResult mint(String caller, BigDecimal reserveAmount) {
        return mutate(tx -> {
            requireNotPaused();
            GovernanceParameters params = governance.snapshot();
            TokenLedger reserve = ledgers.reserve();
            TokenLedger stable = ledgers.stable();
            BigDecimal amount = positive(reserveAmount, reserve.decimals(), "Mint amount");

            BigDecimal reservePrice = priceValidator.getTrustedPrice(AssetId.RESERVE).value();
            BigDecimal unitPrice = priceValidator.unitOfAccountPrice();
            BigDecimal gross = FixedPoint.mulDiv(amount, reservePrice, unitPrice, stable.decimals());
            if (gross.signum() == 0) {
                throw new LedgerException(LedgerErrorCode.ZERO_AMOUNT, "Mint amount too small to issue Stable");
            }
            BigDecimal fee = FixedPoint.bps(gross, params.mintFeeBps(), stable.decimals());
            BigDecimal toCaller = gross.subtract(fee);

            CollateralPosition next = loadPosition().afterMint(amount, gross, clock.instant());

            tx.record(reserveVault.depositReserve(engineAccount(), caller, amount));
            if (toCaller.signum() > 0) {
                tx.record(stable.mint(caller, toCaller));
            }
            if (fee.signum() > 0) {
                tx.record(stable.mint(reserveVault.vaultAccount(), fee));
            }
            positionRepository.save(next);

            log.info("Mint by {}: {} reserve -> {} Stable (fee {})", caller, amount.toPlainString(),
                    toCaller.toPlainString(), fee.toPlainString());
            return new MintResult(amount, gross, toCaller, fee, reservePrice, unitPrice);
        });
    }

    /**
     * Burns Stable for reserve, topping up any collateral shortfall with Bond and, when Bond trades
     * below its floor, with Backstop from the vault.
     */
    public RedemptionResult redeem(String caller, BigDecimal stableAmount) {
        return mutate(tx -> {
            requireNotPaused();
            GovernanceParameters params = governance.snapshot();
            TokenLedger stable = ledgers.stable();
            int reserveDecimals = ledgers.reserve().decimals();
            BigDecimal amount = positive(stableAmount, stable.decimals(), "Redeem amount");

            CollateralPosition position = loadPosition();
            BigDecimal reservePrice = priceValidator.getTrustedPrice(AssetId.RESERVE).value();
            BigDecimal unitPrice = priceValidator.unitOfAccountPrice();
            BigDecimal ratio = RedemptionWaterfall.collateralRatio(position.getTotalReserveUnits(),
                    position.getTotalStableSupplyTracked(), reservePrice, unitPrice);

            BigDecimal fee = FixedPoint.bps(amount, params.redeemFeeBps(), stable.decimals());
            BigDecimal net = amount.subtract(fee);
            RedemptionPlan plan = plan(position, net, ratio, reservePrice, unitPrice, reserveDecimals,
                    params.bondFloorPrice());

            CollateralPosition next = position.afterRedeem(plan.reserveOut(), amount, clock.instant());

            String vault = reserveVault.vaultAccount();
            tx.record(stable.transferIn(caller, amount));
            if (net.signum() > 0) {
                tx.record(stable.burn(vault, net));
            }
            if (plan.reserveOut().signum() > 0) {
                tx.record(reserveVault.withdrawReserve(engineAccount(), caller, plan.reserveOut()));
            }
            if (plan.bondOut().signum() > 0) {
                tx.record(ledgers.bond().mint(caller, plan.bondOut()));
            }
            if (plan.backstopOut().signum() > 0) {
                tx.record(reserveVault.compensate(engineAccount(), caller, plan.backstopOut()));
            }
            positionRepository.save(next);

            log.info("Redeem by {} at CR {}: {} Stable -> {} reserve, {} bond, {} backstop ({})", caller,
                    ratio.toPlainString(), amount.toPlainString(), plan.reserveOut().toPlainString(),
                    plan.bondOut().toPlainString(), plan.backstopOut().toPlainString(), plan.tier());
            return new RedemptionResult(plan.tier(), amount, fee, plan.reserveOut(), plan.bondOut(),
                    plan.backstopOut(), ratio);
        });
    }

    /**
     * Swaps Bond for Stable 1:1 while the protocol is over-collateralized, up to the surplus
     * (CR − 1) × supply. Requests are served in arrival order.
     */
    public BondRedemptionResult redeemBond(String caller, BigDecimal bondAmount) {
        return mutate(tx -> {
            requireNotPaused();
            TokenLedger bond = ledgers.bond();
            TokenLedger stable = ledgers.stable();
            BigDecimal amount = positive(bondAmount, bond.decimals(), "Bond amount");

            CollateralPosition position = loadPosition();
            BigDecimal reservePrice = priceValidator.getTrustedPrice(AssetId.RESERVE).value();
            BigDecimal unitPrice = priceValidator.unitOfAccountPrice();
            BigDecimal cap = surplus(position, reservePrice, unitPrice, stable.decimals());
            if (cap.signum() <= 0) {
                throw new LedgerException(LedgerErrorCode.REDEMPTION_CAP_EXCEEDED,
                        "Bond redemption needs a collateral ratio above 1");
            }
            BigDecimal stableOut = amount.setScale(stable.decimals(), RoundingMode.FLOOR);
            if (stableOut.compareTo(cap) > 0) {
                throw new LedgerException(LedgerErrorCode.REDEMPTION_CAP_EXCEEDED,
                        "Bond redemption of " + stableOut.toPlainString() + " exceeds cap " + cap.toPlainString());
            }

            CollateralPosition next = position.afterBondRedemption(stableOut, clock.instant());

            tx.record(bond.transferIn(caller, amount));
            tx.record(bond.burn(reserveVault.vaultAccount(), amount));
            tx.record(stable.mint(caller, stableOut));
            positionRepository.save(next);

            log.info("Bond redemption by {}: {} Bond -> {} Stable", caller, amount.toPlainString(),
                    stableOut.toPlainString());
            return new BondRedemptionResult(amount, stableOut, cap.subtract(stableOut));
        });
    }

    /**
     * Current collateral ratio at trusted prices, 18 decimals; 1.0 when nothing is issued.
     */
    public BigDecimal collateralRatio() {
        CollateralPosition position = loadPosition();
        if (position.getTotalStableSupplyTracked().signum() == 0) {
            return FixedPoint.ONE;
        }
        return RedemptionWaterfall.collateralRatio(position.getTotalReserveUnits(),
                position.getTotalStableSupplyTracked(),
                priceValidator.getTrustedPrice(AssetId.RESERVE).value(),
                priceValidator.unitOfAccountPrice());
    }

    public PositionView position() {
        CollateralPosition position = loadPosition();
        return new PositionView(position.getTotalReserveUnits(), position.getTotalStableSupplyTracked(),
                position.getUpdatedAt(), paused, adminRole.admin(), adminRole.pendingCandidate().orElse(null));
    }

    public boolean isPaused() {
        return paused;
    }

    public void pause(String caller) {
        adminChange(caller, () -> {
            paused = true;
            log.info("Engine paused by {}", caller);
        });
    }

    public void unpause(String caller) {
        adminChange(caller, () -> {
            paused = false;
            log.info("Engine unpaused by {}", caller);
        });
    }

    public void transferAdmin(String caller, String candidate) {
        serializer.run(() -> guard.enter(() -> {
            adminRole.transfer(caller, candidate);
            log.info("Admin transfer from {} to {} started", caller, candidate);
            return null;
        }));
    }

    public void acceptAdmin(String caller) {
        serializer.run(() -> guard.enter(() -> {
            adminRole.accept(caller);
            log.info("Admin transfer accepted by {}", caller);
            return null;
        }));
    }

    public void cancelAdminTransfer(String caller) {
        serializer.run(() -> guard.enter(() -> {
            adminRole.cancel(caller);
            log.info("Admin transfer cancelled by {}", caller);
            return null;
        }));
    }

    public String admin() {
        return adminRole.admin();
    }

    /**
     * Admin-only parameter write, ordered with ledger mutations: a request already running finishes
     * with the values it started with.
     *
     * @return all parameters after the write
     */
    public Map<ParamType, BigDecimal> setParam(String caller, ParamType type, BigDecimal value) {
        return serializer.execute(() -> guard.enter(() -> {
            adminRole.requireAdmin(caller);
            governance.setParam(type, value);
            return governance.all();
        }));
    }

    private RedemptionPlan plan(CollateralPosition position, BigDecimal net, BigDecimal ratio,
                                BigDecimal reservePrice, BigDecimal unitPrice, int reserveDecimals,
                                BigDecimal floor) {
        if (ratio.compareTo(BigDecimal.ONE) >= 0) {
            return RedemptionWaterfall.fullyBacked(net, reservePrice, unitPrice, reserveDecimals);
        }
        BigDecimal reserveOut = RedemptionWaterfall.proRataReserve(net, position.getTotalReserveUnits(),
                position.getTotalStableSupplyTracked(), reserveDecimals);
        BigDecimal shortfall = RedemptionWaterfall.shortfall(net, reserveOut, reservePrice, unitPrice);
        if (shortfall.signum() == 0) {
            return new RedemptionPlan(RedemptionTier.RESERVE_AND_BOND, reserveOut, BigDecimal.ZERO, BigDecimal.ZERO);
        }
        BigDecimal bondPrice = inUnitsOfAccount(AssetId.BOND, unitPrice);
        if (bondPrice.compareTo(floor) >= 0) {
            return RedemptionWaterfall.withBond(reserveOut, shortfall, bondPrice);
        }
        BigDecimal backstopPrice = inUnitsOfAccount(AssetId.BACKSTOP, unitPrice);
        return RedemptionWaterfall.withBackstop(reserveOut, shortfall, bondPrice, floor, backstopPrice);
    }

    private BigDecimal inUnitsOfAccount(AssetId asset, BigDecimal unitPrice) {
        BigDecimal price = FixedPoint.div(priceValidator.getTrustedPrice(asset).value(), unitPrice);
        if (price.signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.PRICE_UNAVAILABLE, asset + " price is zero");
        }
        return price;
    }

    private static BigDecimal surplus(CollateralPosition position, BigDecimal reservePrice, BigDecimal unitPrice,
                                      int scale) {
        BigDecimal reserveValue = FixedPoint.mulDiv(position.getTotalReserveUnits(), reservePrice, unitPrice, scale);
        return reserveValue.subtract(position.getTotalStableSupplyTracked());
    }

    private <T> T mutate(Function<LedgerTransaction, T> work) {
        return serializer.execute(() -> guard.enter(() -> {
            LedgerTransaction tx = new LedgerTransaction(ledgers);
            try {
                return work.apply(tx);
            } catch (RuntimeException e) {
                tx.rollback(e);
                if (e instanceof LedgerException le) {
                    log.warn("Request rejected: {} {}", le.getErrorCode(), le.getMessage());
                }
                throw e;
            }
        }));
    }

    private void adminChange(String caller, Runnable change) {
        serializer.run(() -> guard.enter(() -> {
            adminRole.requireAdmin(caller);
            change.run();
            return null;
        }));
    }

    private void requireNotPaused() {
        if (paused) {
            throw new LedgerException(LedgerErrorCode.PAUSED, "Engine is paused");
        }
    }

    private static BigDecimal positive(BigDecimal amount, int decimals, String what) {
        BigDecimal scaled = amount == null ? BigDecimal.ZERO : amount.setScale(decimals, RoundingMode.FLOOR);
        if (scaled.signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.ZERO_AMOUNT, what + " must be positive");
        }
        return scaled;
    }

    private CollateralPosition loadPosition() {
        return positionRepository.findById(CollateralPosition.GLOBAL_ID).orElseGet(CollateralPosition::empty);
    }

    private String engineAccount() {
        return collateralProperties.getEngineAccount();
    }
}
