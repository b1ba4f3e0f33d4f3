package com.bit.restake.instant.impl;

import com.bit.restake.access.Role;
import com.bit.restake.aop.annotation.RequiresRole;
import com.bit.restake.common.Address;
import com.bit.restake.common.LedgerLock;
import com.bit.restake.common.ReentrancyGuard;
import com.bit.restake.config.RestakeConfig;
import com.bit.restake.event.EventRecorder;
import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import com.bit.restake.instant.InstantWithdrawer;
import com.bit.restake.risk.PauseFlag;
import com.bit.restake.risk.RiskParameterFeed;
import com.bit.restake.structure.buffer.BufferState;
import com.bit.restake.structure.dto.InstantWithdrawReceipt;
import com.bit.restake.structure.event.EventType;
import com.bit.restake.structure.event.RestakeEvent;
import com.bit.restake.structure.instant.InstantWithdrawConfig;
import com.bit.restake.structure.withdraw.PendingPayout;
import com.bit.restake.withdraw.WithdrawQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

import static com.bit.restake.common.RestakeConstants.BASIS_POINTS;
import static com.bit.restake.common.RestakeConstants.MAX_BASIS_POINTS;
import static com.bit.restake.common.RestakeConstants.SCALE_FACTOR;
import static com.bit.restake.util.Validations.min;
import static com.bit.restake.util.Validations.requireNonZero;
import static com.bit.restake.util.Validations.requirePositive;

@Slf4j
@Service
public class InstantWithdrawerImpl implements InstantWithdrawer {

    private final Address self;
    private final WithdrawQueue withdrawQueue;
    private final RiskParameterFeed riskFeed;
    private final EventRecorder eventRecorder;
    private final ReentrancyGuard guard;

    private InstantWithdrawConfig config;
    private boolean paused;

    public InstantWithdrawerImpl(RestakeConfig restakeConfig, WithdrawQueue withdrawQueue, RiskParameterFeed riskFeed,
                                 EventRecorder eventRecorder, LedgerLock ledgerLock) {
        this.self = restakeConfig.instantWithdrawerAddress();
        this.withdrawQueue = withdrawQueue;
        this.riskFeed = riskFeed;
        this.eventRecorder = eventRecorder;
        this.guard = new ReentrancyGuard("InstantWithdrawer", ledgerLock);

        RestakeConfig.InstantWithdraw defaults = restakeConfig.getInstantWithdraw();
        InstantWithdrawConfig initial = new InstantWithdrawConfig(defaults.getDrawdownLimitBps(),
                defaults.getMinFeeBps(), defaults.getMaxFeeBps(), Address.fromHex(defaults.getFeeDestination()));
        validate(initial);
        this.config = initial;
    }

    @Override
    public Address getAddress() {
        return self;
    }

    @Override
    public InstantWithdrawReceipt withdraw(Address user, BigInteger shares, Address asset, BigInteger minOut) {
        requireNonZero(user, "user");
        requireNonZero(asset, "asset");
        requirePositive(shares, "shares");
        BigInteger minimum = minOut == null ? BigInteger.ZERO : minOut;
        return guard.call(() -> {
            if (paused || riskFeed.isPaused(PauseFlag.INSTANT_WITHDRAW)) {
                throw new RestakeException(ErrorType.PAUSED, "instant withdraw");
            }
            InstantWithdrawReceipt quote = quote(shares, asset);
            if (quote.getNetAmount().compareTo(minimum) < 0) {
                throw new RestakeException(ErrorType.MIN_OUT_NOT_MET,
                        "net=" + quote.getNetAmount() + " minOut=" + minimum);
            }

            // 净额和手续费都由队列在结算内支付，失败时份额和缓冲一并恢复
            PendingPayout payout = withdrawQueue.instantRedeem(self, user, shares, asset, quote.getFeeBps(),
                    config.getFeeDestination());
            BigInteger fee = payout.getFee();
            BigInteger net = payout.netAmount();

            InstantWithdrawReceipt receipt = new InstantWithdrawReceipt(payout.getRequestId(), asset, shares,
                    payout.getAmount(), quote.getFeeBps(), fee, net);
            log.info("instant withdraw user={} {}", user, receipt);
            eventRecorder.record(RestakeEvent.builder()
                    .type(EventType.INSTANT_WITHDRAW)
                    .account(user)
                    .asset(asset)
                    .amount(net)
                    .shares(shares)
                    .requestId(payout.getRequestId())
                    .detail("feeBps=" + quote.getFeeBps() + " fee=" + fee)
                    .build());
            return receipt;
        });
    }

    @Override
    public InstantWithdrawReceipt preview(BigInteger shares, Address asset) {
        requirePositive(shares, "shares");
        return guard.read(() -> quote(shares, asset));
    }

    /**
     * 手续费随缓冲剩余比例线性插值：
     * 缓冲满 -> minFee，降到回撤下限 -> maxFee
     */
    private InstantWithdrawReceipt quote(BigInteger shares, Address asset) {
        BufferState buffer = withdrawQueue.bufferState(asset);
        if (buffer.getTarget().signum() == 0) {
            throw new RestakeException(ErrorType.UNSUPPORTED_ASSET, "缓冲目标未设置: " + asset);
        }
        BigInteger amount = withdrawQueue.quoteRedeem(shares, asset);
        BigInteger available = buffer.available();
        if (amount.compareTo(available) > 0) {
            throw new RestakeException(ErrorType.INSUFFICIENT_BUFFER, "需要 " + amount + " 可用 " + available);
        }
        BigInteger target = buffer.getTarget();
        BigInteger floor = target.multiply(BigInteger.valueOf(config.getDrawdownLimitBps())).divide(BASIS_POINTS);
        BigInteger after = available.subtract(amount);
        if (after.compareTo(floor) < 0) {
            throw new RestakeException(ErrorType.BELOW_DRAWDOWN_FLOOR, "提现后 " + after + " 下限 " + floor);
        }
        BigInteger remaining = min(after.subtract(floor).multiply(SCALE_FACTOR).divide(target.subtract(floor)),
                SCALE_FACTOR);
        BigInteger spread = BigInteger.valueOf(config.getMaxFeeBps() - config.getMinFeeBps());
        int feeBps = BigInteger.valueOf(config.getMaxFeeBps())
                .subtract(spread.multiply(remaining).divide(SCALE_FACTOR))
                .intValueExact();
        BigInteger fee = amount.multiply(BigInteger.valueOf(feeBps)).divide(BASIS_POINTS);
        return new InstantWithdrawReceipt(0L, asset, shares, amount, feeBps, fee, amount.subtract(fee));
    }

    @Override
    public InstantWithdrawConfig getConfig() {
        return guard.read(() -> new InstantWithdrawConfig(config.getDrawdownLimitBps(), config.getMinFeeBps(),
                config.getMaxFeeBps(), config.getFeeDestination()));
    }

    @Override
    @RequiresRole(Role.INSTANT_WITHDRAW_ADMIN)
    public void setConfig(Address caller, InstantWithdrawConfig newConfig) {
        validate(newConfig);
        guard.run(() -> {
            this.config = new InstantWithdrawConfig(newConfig.getDrawdownLimitBps(), newConfig.getMinFeeBps(),
                    newConfig.getMaxFeeBps(), newConfig.getFeeDestination());
            log.info("instant withdraw config updated by {}: {}", caller, config);
            eventRecorder.record(RestakeEvent.builder()
                    .type(EventType.CONFIG_CHANGED)
                    .account(caller)
                    .detail("InstantWithdrawer " + config)
                    .build());
        });
    }

    @Override
    @RequiresRole(Role.DEPOSIT_WITHDRAW_PAUSER)
    public void setPaused(Address caller, boolean paused) {
        guard.run(() -> {
            this.paused = paused;
            log.warn("instant withdraw paused={} by {}", paused, caller);
        });
    }

    @Override
    public boolean isPaused() {
        return guard.read(() -> paused);
    }

    private static void validate(InstantWithdrawConfig config) {
        if (config == null) {
            throw new RestakeException(ErrorType.INVALID_FEE_CONFIG, "config 为空");
        }
        requireNonZero(config.getFeeDestination(), "feeDestination");
        if (config.getDrawdownLimitBps() < 0 || config.getDrawdownLimitBps() >= MAX_BASIS_POINTS) {
            throw new RestakeException(ErrorType.INVALID_FEE_CONFIG, "drawdownLimitBps=" + config.getDrawdownLimitBps());
        }
        if (config.getMinFeeBps() < 0 || config.getMinFeeBps() > config.getMaxFeeBps()
                || config.getMaxFeeBps() > MAX_BASIS_POINTS) {
            throw new RestakeException(ErrorType.INVALID_FEE_CONFIG,
                    "minFeeBps=" + config.getMinFeeBps() + " maxFeeBps=" + config.getMaxFeeBps());
        }
    }
}
