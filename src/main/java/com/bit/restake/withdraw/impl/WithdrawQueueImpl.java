package com.bit.restake.withdraw.impl;

import com.bit.restake.access.Role;
import com.bit.restake.accounting.DepositQueue;
import com.bit.restake.accounting.TvlCalculator;
import com.bit.restake.aop.annotation.RequiresRole;
import com.bit.restake.common.Address;
import com.bit.restake.common.LedgerLock;
import com.bit.restake.common.ReentrancyGuard;
import com.bit.restake.common.UndoLog;
import com.bit.restake.config.RestakeConfig;
import com.bit.restake.event.EventRecorder;
import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import com.bit.restake.oracle.PriceOracle;
import com.bit.restake.registry.AssetRegistry;
import com.bit.restake.risk.PauseFlag;
import com.bit.restake.risk.RiskParameterFeed;
import com.bit.restake.storage.StorageMigrations;
import com.bit.restake.storage.WithdrawQueueStorage;
import com.bit.restake.structure.buffer.BufferFill;
import com.bit.restake.structure.buffer.BufferState;
import com.bit.restake.structure.event.EventType;
import com.bit.restake.structure.event.RestakeEvent;
import com.bit.restake.structure.tvl.TotalValues;
import com.bit.restake.structure.withdraw.PendingPayout;
import com.bit.restake.structure.withdraw.WithdrawRequest;
import com.bit.restake.token.AssetLedger;
import com.bit.restake.token.ShareToken;
import com.bit.restake.withdraw.WithdrawQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.bit.restake.common.RestakeConstants.BASIS_POINTS;
import static com.bit.restake.util.Validations.min;
import static com.bit.restake.util.Validations.requireBasisPoints;
import static com.bit.restake.util.Validations.requireNonNegative;
import static com.bit.restake.util.Validations.requireNonZero;
import static com.bit.restake.util.Validations.requirePositive;

@Slf4j
@Service
public class WithdrawQueueImpl implements WithdrawQueue {

    private final Address self;
    private final Clock clock;
    private final PriceOracle priceOracle;
    private final TvlCalculator tvlCalculator;
    private final WithdrawQueueStorage storage;
    private final AssetRegistry assetRegistry;
    private final DepositQueue depositQueue;
    private final ShareToken shareToken;
    private final AssetLedger assetLedger;
    private final RiskParameterFeed riskFeed;
    private final EventRecorder eventRecorder;
    private final ReentrancyGuard guard;

    public WithdrawQueueImpl(RestakeConfig config, Clock clock, PriceOracle priceOracle, TvlCalculator tvlCalculator,
                             WithdrawQueueStorage storage, AssetRegistry assetRegistry, DepositQueue depositQueue,
                             ShareToken shareToken, AssetLedger assetLedger, RiskParameterFeed riskFeed,
                             EventRecorder eventRecorder, LedgerLock ledgerLock) {
        this.self = config.withdrawQueueAddress();
        this.clock = clock;
        this.priceOracle = priceOracle;
        this.tvlCalculator = tvlCalculator;
        this.storage = storage;
        this.assetRegistry = assetRegistry;
        this.depositQueue = depositQueue;
        this.shareToken = shareToken;
        this.assetLedger = assetLedger;
        this.riskFeed = riskFeed;
        this.eventRecorder = eventRecorder;
        this.guard = new ReentrancyGuard("WithdrawQueue", ledgerLock);

        StorageMigrations.migrate(storage);
        if (storage.getCooldownSeconds() < 0) {
            storage.setCooldownSeconds(config.getCooldownSeconds());
        }
    }

    @Override
    public Address getAddress() {
        return self;
    }

    @Override
    public WithdrawRequest withdraw(Address user, BigInteger shares, Address asset) {
        requireNonZero(user, "user");
        requireNonZero(asset, "asset");
        requirePositive(shares, "shares");
        return guard.call(() -> {
            checkNotPaused(PauseFlag.WITHDRAW);
            BufferState buffer = supportedBuffer(asset);
            checkShareBalance(user, shares);

            TotalValues totals = tvlCalculator.calculate();
            BigInteger redeemValue = redeemValue(shares, totals);
            BigInteger amount = toAssetAmount(asset, redeemValue);
            BigInteger available = buffer.available();
            boolean queued = amount.compareTo(available) > 0;
            if (queued) {
                // 委托持有 + 暂存原生币 + 缓冲可用，扣除已承诺给更早排队请求的部分，必须覆盖本次请求
                BigInteger backing = totals.columnTotal(totals.columnOf(asset))
                        .add(priceOracle.lookupValue(asset, available));
                if (asset.isNative()) {
                    backing = backing.add(depositQueue.stagedBalance());
                }
                BigInteger promised = buffer.queueDeficit();
                if (promised.signum() > 0) {
                    backing = backing.subtract(priceOracle.lookupValue(asset, promised));
                }
                if (redeemValue.compareTo(backing) > 0) {
                    throw new RestakeException(ErrorType.INSUFFICIENT_COLLATERAL,
                            "需要价值 " + redeemValue + " 可用 " + backing);
                }
            }

            // 份额转入托管，失败时账本未改动
            shareToken.transfer(user, self, shares);

            WithdrawRequest request = WithdrawRequest.builder()
                    .id(storage.getNextRequestId())
                    .asset(asset)
                    .sharesLocked(shares)
                    .amountToRedeem(amount)
                    .createdAt(now())
                    .queued(queued)
                    .build();
            storage.setNextRequestId(request.getId() + 1);
            if (queued) {
                buffer.setClaimReserve(buffer.getClaimReserve().add(available));
                buffer.setQueueToFill(buffer.getQueueToFill().add(amount.subtract(available)));
                request.setFillAt(buffer.getQueueToFill());
            } else {
                buffer.setClaimReserve(buffer.getClaimReserve().add(amount));
            }
            storage.requestsOf(user).add(request);

            log.info("withdraw request #{} user={} asset={} shares={} amount={} queued={}",
                    request.getId(), user, asset, shares, amount, queued);
            eventRecorder.record(RestakeEvent.builder()
                    .type(queued ? EventType.WITHDRAW_QUEUED : EventType.WITHDRAW_REQUESTED)
                    .account(user)
                    .asset(asset)
                    .amount(amount)
                    .shares(shares)
                    .requestId(request.getId())
                    .detail(queued ? "fillAt=" + request.getFillAt() : null)
                    .build());
            return request.copy();
        });
    }

    @Override
    @RequiresRole(Role.BUFFER_FILLER)
    public BufferFill fillBuffer(Address caller, Address asset, BigInteger amount) {
        requireNonZero(asset, "asset");
        requirePositive(amount, "amount");
        return guard.call(() -> {
            assetLedger.transfer(asset, caller, self, amount);

            BufferState buffer = storage.buffer(asset);
            BigInteger filled = min(amount, buffer.queueDeficit());
            if (filled.signum() > 0) {
                buffer.setQueueFilled(buffer.getQueueFilled().add(filled));
                buffer.setClaimReserve(buffer.getClaimReserve().add(filled));
                eventRecorder.record(RestakeEvent.builder()
                        .type(EventType.QUEUE_FILLED)
                        .account(caller)
                        .asset(asset)
                        .amount(filled)
                        .detail("queueFilled=" + buffer.getQueueFilled())
                        .build());
            }
            buffer.setBalance(buffer.getBalance().add(amount));
            log.debug("buffer {} filled {} (queue {}), balance={} reserve={}",
                    asset, amount, filled, buffer.getBalance(), buffer.getClaimReserve());
            eventRecorder.record(RestakeEvent.builder()
                    .type(EventType.BUFFER_FILLED)
                    .account(caller)
                    .asset(asset)
                    .amount(amount)
                    .build());
            return new BufferFill(caller, asset, amount, filled, buffer.getBalance(), buffer.getQueueFilled());
        });
    }

    @Override
    @RequiresRole(Role.BUFFER_FILLER)
    public void revertFill(Address caller, BufferFill fill) {
        if (!caller.equals(fill.getFiller())) {
            throw new RestakeException(ErrorType.NOT_AUTHORIZED, caller + " 不是回补方 " + fill.getFiller());
        }
        guard.run(() -> {
            BufferState buffer = storage.buffer(fill.getAsset());
            if (!buffer.getBalance().equals(fill.getBalanceAfter())
                    || !buffer.getQueueFilled().equals(fill.getQueueFilledAfter())) {
                throw new IllegalStateException("缓冲在回补后已变动，无法撤回: " + fill);
            }
            // 先退款，失败时缓冲不变
            assetLedger.transfer(fill.getAsset(), self, fill.getFiller(), fill.getAmount());
            buffer.setBalance(buffer.getBalance().subtract(fill.getAmount()));
            buffer.setQueueFilled(buffer.getQueueFilled().subtract(fill.getQueuePortion()));
            buffer.setClaimReserve(buffer.getClaimReserve().subtract(fill.getQueuePortion()));
            log.warn("buffer {} fill of {} reverted to {}", fill.getAsset(), fill.getAmount(), fill.getFiller());
            eventRecorder.record(RestakeEvent.builder()
                    .type(EventType.BUFFER_FILL_REVERTED)
                    .account(caller)
                    .asset(fill.getAsset())
                    .amount(fill.getAmount())
                    .build());
        });
    }

    @Override
    public PendingPayout claim(int requestIndex, Address user) {
        requireNonZero(user, "user");
        return guard.call(() -> {
            checkNotPaused(PauseFlag.CLAIM);
            List<WithdrawRequest> requests = storage.getRequests().get(user);
            if (requests == null || requestIndex < 0 || requestIndex >= requests.size()) {
                throw new RestakeException(ErrorType.INVALID_REQUEST_INDEX, "user=" + user + " index=" + requestIndex);
            }
            WithdrawRequest request = requests.get(requestIndex);
            long cooldown = effectiveCooldownSeconds();
            if (now() - request.getCreatedAt() < cooldown) {
                throw new RestakeException(ErrorType.EARLY_CLAIM,
                        "请求#" + request.getId() + " 创建于 " + request.getCreatedAt() + " 冷却期 " + cooldown + "s");
            }
            BufferState buffer = storage.buffer(request.getAsset());
            if (request.isQueued() && request.getFillAt().compareTo(buffer.getQueueFilled()) > 0) {
                throw new RestakeException(ErrorType.QUEUED_WITHDRAWAL_NOT_FILLED,
                        "请求#" + request.getId() + " fillAt=" + request.getFillAt() + " queueFilled=" + buffer.getQueueFilled());
            }
            return settle(requests, requestIndex, user, user, 0, null);
        });
    }

    @Override
    @RequiresRole(Role.INSTANT_WITHDRAWER)
    public PendingPayout instantRedeem(Address caller, Address user, BigInteger shares, Address asset, int feeBps,
                                       Address feeRecipient) {
        requireNonZero(user, "user");
        requireNonZero(asset, "asset");
        requirePositive(shares, "shares");
        requireBasisPoints(feeBps, "feeBps");
        if (feeBps > 0) {
            requireNonZero(feeRecipient, "feeRecipient");
        }
        return guard.call(() -> {
            checkNotPaused(PauseFlag.WITHDRAW);
            BufferState buffer = supportedBuffer(asset);
            checkShareBalance(user, shares);

            BigInteger amount = toAssetAmount(asset, redeemValue(shares, tvlCalculator.calculate()));
            if (amount.compareTo(buffer.available()) > 0) {
                throw new RestakeException(ErrorType.INSUFFICIENT_BUFFER,
                        "需要 " + amount + " 可用 " + buffer.available());
            }

            UndoLog undo = new UndoLog();
            try {
                shareToken.transfer(user, self, shares);
                undo.push(() -> shareToken.transfer(self, user, shares));

                WithdrawRequest request = WithdrawRequest.builder()
                        .id(storage.getNextRequestId())
                        .asset(asset)
                        .sharesLocked(shares)
                        .amountToRedeem(amount)
                        .createdAt(now())
                        .instant(true)
                        .build();
                storage.setNextRequestId(request.getId() + 1);
                buffer.setClaimReserve(buffer.getClaimReserve().add(amount));
                List<WithdrawRequest> requests = storage.requestsOf(user);
                requests.add(request);
                undo.push(() -> {
                    requests.remove(request);
                    buffer.setClaimReserve(buffer.getClaimReserve().subtract(amount));
                    storage.setNextRequestId(request.getId());
                });

                return settle(requests, requests.size() - 1, user, user, feeBps, feeRecipient);
            } catch (RuntimeException e) {
                undo.rollback(e);
                throw e;
            }
        });
    }

    /**
     * 领取结算：先把内部状态提交为待支付结果并销毁份额，再执行外部划转
     * 有手续费时先付用户净额再付手续费，任一划转失败都撤回已付部分，
     * 恢复缓冲和请求，重新铸造已销毁的份额到托管地址
     */
    private PendingPayout settle(List<WithdrawRequest> requests, int index, Address user, Address recipient,
                                 int feeBps, Address feeRecipient) {
        WithdrawRequest request = requests.get(index);
        BufferState buffer = storage.buffer(request.getAsset());
        BigInteger reserveBefore = buffer.getClaimReserve();
        BigInteger balanceBefore = buffer.getBalance();

        // 按当前净值重算，只降不升
        BigInteger current = toAssetAmount(request.getAsset(),
                redeemValue(request.getSharesLocked(), tvlCalculator.calculate()));
        BigInteger payout = min(request.getAmountToRedeem(), current);
        BigInteger fee = payout.multiply(BigInteger.valueOf(feeBps)).divide(BASIS_POINTS);

        // 释放全部预留，只扣除实际支付，差额留在缓冲可用部分
        buffer.setClaimReserve(buffer.getClaimReserve().subtract(request.getAmountToRedeem()));
        buffer.setBalance(buffer.getBalance().subtract(payout));
        swapRemove(requests, index);
        PendingPayout pending = new PendingPayout(request.getId(), recipient, request.getAsset(), payout,
                request.getSharesLocked(), request.getAmountToRedeem(), fee, fee.signum() > 0 ? feeRecipient : null);

        UndoLog legs = new UndoLog();
        boolean burned = false;
        try {
            shareToken.burn(self, pending.getSharesBurned());
            burned = true;
            Address asset = pending.getAsset();
            BigInteger net = pending.netAmount();
            if (net.signum() > 0) {
                assetLedger.transfer(asset, self, recipient, net);
                legs.push(() -> assetLedger.transfer(asset, recipient, self, net));
            }
            if (fee.signum() > 0) {
                assetLedger.transfer(asset, self, feeRecipient, fee);
            }
        } catch (RuntimeException e) {
            log.warn("claim #{} payout failed, restoring state: {}", request.getId(), e.getMessage());
            legs.rollback(e);
            buffer.setClaimReserve(reserveBefore);
            buffer.setBalance(balanceBefore);
            reinsert(requests, index, request);
            if (burned) {
                shareToken.mint(self, pending.getSharesBurned());
            }
            throw e;
        }

        log.info("claimed request #{} user={} asset={} payout={} fee={} original={}",
                request.getId(), user, request.getAsset(), payout, fee, request.getAmountToRedeem());
        eventRecorder.record(RestakeEvent.builder()
                .type(EventType.CLAIMED)
                .account(user)
                .asset(request.getAsset())
                .amount(payout)
                .shares(request.getSharesLocked())
                .requestId(request.getId())
                .detail(request.isInstant() ? "instant fee=" + fee : null)
                .build());
        return pending;
    }

    // 交换删除：末尾元素移到被删位置
    private static void swapRemove(List<WithdrawRequest> requests, int index) {
        WithdrawRequest last = requests.remove(requests.size() - 1);
        if (index < requests.size()) {
            requests.set(index, last);
        }
    }

    private static void reinsert(List<WithdrawRequest> requests, int index, WithdrawRequest request) {
        if (index < requests.size()) {
            WithdrawRequest moved = requests.get(index);
            requests.set(index, request);
            requests.add(moved);
        } else {
            requests.add(request);
        }
    }

    @Override
    public BigInteger availableToWithdraw(Address asset) {
        return guard.read(() -> {
            BufferState buffer = storage.getBuffers().get(asset);
            return buffer == null ? BigInteger.ZERO : buffer.available();
        });
    }

    @Override
    public BigInteger withdrawDeficit(Address asset) {
        return guard.read(() -> {
            BufferState buffer = storage.getBuffers().get(asset);
            if (buffer == null) {
                return BigInteger.ZERO;
            }
            BigInteger bufferGap = buffer.getTarget().subtract(buffer.available()).max(BigInteger.ZERO);
            return bufferGap.add(buffer.queueDeficit());
        });
    }

    @Override
    public BigInteger quoteRedeem(BigInteger shares, Address asset) {
        requirePositive(shares, "shares");
        return guard.read(() -> toAssetAmount(asset, redeemValue(shares, tvlCalculator.calculate())));
    }

    @Override
    public BufferState bufferState(Address asset) {
        return guard.read(() -> {
            BufferState buffer = storage.getBuffers().get(asset);
            return buffer == null ? new BufferState() : buffer.copy();
        });
    }

    @Override
    public List<WithdrawRequest> withdrawRequests(Address user) {
        return guard.read(() -> {
            List<WithdrawRequest> requests = storage.getRequests().get(user);
            List<WithdrawRequest> copies = new ArrayList<>();
            if (requests != null) {
                requests.forEach(r -> copies.add(r.copy()));
            }
            return copies;
        });
    }

    @Override
    public Duration effectiveCooldown() {
        return Duration.ofSeconds(guard.read(this::effectiveCooldownSeconds));
    }

    @Override
    @RequiresRole(Role.WITHDRAW_QUEUE_ADMIN)
    public void setBufferTarget(Address caller, Address asset, BigInteger target) {
        requireNonZero(asset, "asset");
        requireNonNegative(target, "target");
        guard.run(() -> {
            if (!asset.isNative() && !assetRegistry.contains(asset)) {
                throw new RestakeException(ErrorType.UNSUPPORTED_ASSET, asset.toHex());
            }
            BufferState buffer = storage.buffer(asset);
            BigInteger old = buffer.getTarget();
            buffer.setTarget(target);
            log.info("buffer target {} {} -> {}", asset, old, target);
            recordConfigChange(caller, "bufferTarget " + asset + " " + old + " -> " + target);
        });
    }

    @Override
    @RequiresRole(Role.WITHDRAW_QUEUE_ADMIN)
    public void setCooldown(Address caller, long cooldownSeconds) {
        if (cooldownSeconds < 0) {
            throw new RestakeException(ErrorType.INVALID_ZERO_INPUT, "cooldownSeconds=" + cooldownSeconds);
        }
        guard.run(() -> {
            long old = storage.getCooldownSeconds();
            storage.setCooldownSeconds(cooldownSeconds);
            recordConfigChange(caller, "cooldown " + old + " -> " + cooldownSeconds);
        });
    }

    @Override
    @RequiresRole(Role.DEPOSIT_WITHDRAW_PAUSER)
    public void setPaused(Address caller, boolean paused) {
        guard.run(() -> {
            storage.setPaused(paused);
            log.warn("withdraw queue paused={} by {}", paused, caller);
            recordConfigChange(caller, "paused=" + paused);
        });
    }

    @Override
    public boolean isPaused() {
        return guard.read(storage::isPaused);
    }

    private void checkNotPaused(PauseFlag flag) {
        if (storage.isPaused() || riskFeed.isPaused(flag)) {
            throw new RestakeException(ErrorType.PAUSED, "withdraw queue " + flag);
        }
    }

    private BufferState supportedBuffer(Address asset) {
        BufferState buffer = storage.getBuffers().get(asset);
        if (buffer == null || buffer.getTarget().signum() == 0) {
            throw new RestakeException(ErrorType.UNSUPPORTED_ASSET, "缓冲目标未设置: " + asset);
        }
        return buffer;
    }

    private void checkShareBalance(Address user, BigInteger shares) {
        BigInteger balance = shareToken.balanceOf(user);
        if (balance.compareTo(shares) < 0) {
            throw new RestakeException(ErrorType.INSUFFICIENT_SHARES, "持有 " + balance + " 需要 " + shares);
        }
    }

    private BigInteger redeemValue(BigInteger shares, TotalValues totals) {
        return priceOracle.calculateRedeemAmount(shares, shareToken.totalSupply(), totals.getGrandTotal());
    }

    private BigInteger toAssetAmount(Address asset, BigInteger value) {
        BigInteger amount = priceOracle.lookupAmountFromValue(asset, value);
        if (amount.signum() <= 0) {
            throw new RestakeException(ErrorType.ZERO_REDEEM_AMOUNT, "asset=" + asset + " value=" + value);
        }
        return amount;
    }

    private long effectiveCooldownSeconds() {
        return Math.max(storage.getCooldownSeconds(), riskFeed.cooldownOverride().getSeconds());
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private void recordConfigChange(Address caller, String detail) {
        eventRecorder.record(RestakeEvent.builder()
                .type(EventType.CONFIG_CHANGED)
                .account(caller)
                .detail("WithdrawQueue " + detail)
                .build());
    }
}
