package com.bit.restake.accounting.impl;

import com.bit.restake.access.Role;
import com.bit.restake.accounting.AccountingService;
import com.bit.restake.accounting.DelegateSelector;
import com.bit.restake.accounting.DepositQueue;
import com.bit.restake.accounting.RefillBook;
import com.bit.restake.accounting.TvlCalculator;
import com.bit.restake.aop.annotation.RequiresRole;
import com.bit.restake.common.Address;
import com.bit.restake.common.LedgerLock;
import com.bit.restake.common.ReentrancyGuard;
import com.bit.restake.common.UndoLog;
import com.bit.restake.config.RestakeConfig;
import com.bit.restake.delegate.OperatorPool;
import com.bit.restake.event.EventRecorder;
import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import com.bit.restake.oracle.PriceOracle;
import com.bit.restake.registry.AssetRegistry;
import com.bit.restake.registry.DelegateRegistry;
import com.bit.restake.risk.PauseFlag;
import com.bit.restake.risk.RiskParameterFeed;
import com.bit.restake.structure.asset.CollateralAsset;
import com.bit.restake.structure.buffer.BufferFill;
import com.bit.restake.structure.delegate.OperatorDelegate;
import com.bit.restake.structure.dto.DepositReceipt;
import com.bit.restake.structure.dto.RefillTicket;
import com.bit.restake.structure.event.EventType;
import com.bit.restake.structure.event.RestakeEvent;
import com.bit.restake.structure.tvl.TotalValues;
import com.bit.restake.token.AssetLedger;
import com.bit.restake.token.ShareToken;
import com.bit.restake.withdraw.WithdrawQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

import static com.bit.restake.common.RestakeConstants.SUPPORTED_DECIMALS;
import static com.bit.restake.util.Validations.min;
import static com.bit.restake.util.Validations.requireBasisPoints;
import static com.bit.restake.util.Validations.requireNonNegative;
import static com.bit.restake.util.Validations.requireNonZero;
import static com.bit.restake.util.Validations.requirePositive;

@Slf4j
@Service
public class AccountingServiceImpl implements AccountingService {

    private final Address self;
    private final TvlCalculator tvlCalculator;
    private final AssetRegistry assetRegistry;
    private final DelegateRegistry delegateRegistry;
    private final PriceOracle priceOracle;
    private final WithdrawQueue withdrawQueue;
    private final DepositQueue depositQueue;
    private final ShareToken shareToken;
    private final AssetLedger assetLedger;
    private final RiskParameterFeed riskFeed;
    private final EventRecorder eventRecorder;
    private final RefillBook refillBook;
    private final ReentrancyGuard guard;

    private BigInteger maxDepositTvl = BigInteger.ZERO;
    private boolean paused;

    public AccountingServiceImpl(RestakeConfig config, TvlCalculator tvlCalculator, AssetRegistry assetRegistry,
                                 DelegateRegistry delegateRegistry, PriceOracle priceOracle,
                                 WithdrawQueue withdrawQueue, DepositQueue depositQueue, ShareToken shareToken,
                                 AssetLedger assetLedger, RiskParameterFeed riskFeed, EventRecorder eventRecorder,
                                 RefillBook refillBook, LedgerLock ledgerLock) {
        this.self = config.accountingAddress();
        this.tvlCalculator = tvlCalculator;
        this.assetRegistry = assetRegistry;
        this.delegateRegistry = delegateRegistry;
        this.priceOracle = priceOracle;
        this.withdrawQueue = withdrawQueue;
        this.depositQueue = depositQueue;
        this.shareToken = shareToken;
        this.assetLedger = assetLedger;
        this.riskFeed = riskFeed;
        this.eventRecorder = eventRecorder;
        this.refillBook = refillBook;
        this.guard = new ReentrancyGuard("AccountingCore", ledgerLock);
    }

    @Override
    public Address getAddress() {
        return self;
    }

    @Override
    public TotalValues calculateTotalValues() {
        return guard.read(tvlCalculator::calculate);
    }

    @Override
    public OperatorDelegate chooseDelegateForDeposit(List<BigInteger> perDelegateTotal, BigInteger grandTotal) {
        return guard.read(() -> {
            List<OperatorDelegate> delegates = delegateRegistry.list();
            return delegates.get(DelegateSelector.chooseForDeposit(delegates, perDelegateTotal, grandTotal));
        });
    }

    @Override
    public OperatorDelegate chooseDelegateForWithdraw(int assetIndex, BigInteger value,
                                                      List<List<BigInteger>> perDelegatePerAsset,
                                                      List<BigInteger> perDelegateTotal, BigInteger grandTotal) {
        return guard.read(() -> {
            List<OperatorDelegate> delegates = delegateRegistry.list();
            return delegates.get(DelegateSelector.chooseForWithdraw(delegates, assetIndex, value,
                    perDelegatePerAsset, perDelegateTotal, grandTotal));
        });
    }

    @Override
    public DepositReceipt deposit(Address user, Address asset, BigInteger amount, long referralId) {
        requireNonZero(user, "user");
        requireNonZero(asset, "asset");
        requirePositive(amount, "amount");
        return guard.call(() -> {
            checkNotPaused();
            CollateralAsset collateral = assetRegistry.get(asset);

            TotalValues totals = tvlCalculator.calculate();
            BigInteger value = priceOracle.lookupValue(asset, amount);
            checkTvlCap(totals, value);
            if (collateral.getValueCap().signum() > 0) {
                BigInteger bufferBalance = withdrawQueue.bufferState(asset).getBalance();
                BigInteger assetTvl = totals.columnTotal(totals.columnOf(asset))
                        .add(bufferBalance.signum() == 0 ? BigInteger.ZERO : priceOracle.lookupValue(asset, bufferBalance));
                if (assetTvl.add(value).compareTo(collateral.getValueCap()) > 0) {
                    throw new RestakeException(ErrorType.MAX_ASSET_TVL_REACHED,
                            "asset=" + asset + " tvl=" + assetTvl + " value=" + value + " cap=" + collateral.getValueCap());
                }
            }
            BigInteger shares = priceOracle.calculateMintAmount(totals.getGrandTotal(), value, shareToken.totalSupply());

            UndoLog undo = new UndoLog();
            try {
                assetLedger.transfer(asset, user, self, amount);
                undo.push(() -> assetLedger.transfer(asset, self, user, amount));

                BigInteger bufferFilled = min(amount, withdrawQueue.withdrawDeficit(asset));
                BigInteger remainder = amount.subtract(bufferFilled);
                fillBuffer(asset, bufferFilled, undo);

                OperatorPool pool = null;
                Address routed = null;
                if (remainder.signum() > 0) {
                    OperatorDelegate delegate = delegateRegistry.get(
                            DelegateSelector.chooseForDeposit(delegateRegistry.list(), totals.getPerDelegateTotal(),
                                    totals.getGrandTotal()));
                    pool = delegate.getPool();
                    moveToPool(pool, asset, remainder, undo);
                    routed = delegate.getAddress();
                }
                shareToken.mint(user, shares);
                undo.push(() -> shareToken.burn(user, shares));

                // 池记账没有撤销路径，必须是最后一步
                if (pool != null) {
                    pool.deposit(asset, remainder);
                }

                log.info("deposit user={} asset={} amount={} value={} shares={} buffer={} delegate={} referral={}",
                        user, asset, amount, value, shares, bufferFilled, routed, referralId);
                eventRecorder.record(RestakeEvent.builder()
                        .type(EventType.DEPOSIT)
                        .account(user)
                        .asset(asset)
                        .amount(amount)
                        .shares(shares)
                        .detail("referralId=" + referralId)
                        .build());
                return new DepositReceipt(asset, amount, value, shares, bufferFilled, routed);
            } catch (RuntimeException e) {
                undo.rollback(e);
                throw e;
            }
        });
    }

    @Override
    public DepositReceipt depositNative(Address user, BigInteger amount, long referralId) {
        requireNonZero(user, "user");
        requirePositive(amount, "amount");
        return guard.call(() -> {
            checkNotPaused();
            TotalValues totals = tvlCalculator.calculate();
            checkTvlCap(totals, amount);
            BigInteger shares = priceOracle.calculateMintAmount(totals.getGrandTotal(), amount, shareToken.totalSupply());

            UndoLog undo = new UndoLog();
            try {
                assetLedger.transfer(Address.NATIVE, user, self, amount);
                undo.push(() -> assetLedger.transfer(Address.NATIVE, self, user, amount));

                BigInteger bufferFilled = min(amount, withdrawQueue.withdrawDeficit(Address.NATIVE));
                BigInteger remainder = amount.subtract(bufferFilled);
                fillBuffer(Address.NATIVE, bufferFilled, undo);
                shareToken.mint(user, shares);
                undo.push(() -> shareToken.burn(user, shares));

                // 原生币凑满验证者存款前先暂存，暂存不可撤销，放在最后
                if (remainder.signum() > 0) {
                    depositQueue.stage(self, remainder);
                }

                log.info("native deposit user={} amount={} shares={} buffer={} staged={} referral={}",
                        user, amount, shares, bufferFilled, remainder, referralId);
                eventRecorder.record(RestakeEvent.builder()
                        .type(EventType.NATIVE_DEPOSIT)
                        .account(user)
                        .asset(Address.NATIVE)
                        .amount(amount)
                        .shares(shares)
                        .detail("referralId=" + referralId)
                        .build());
                return new DepositReceipt(Address.NATIVE, amount, amount, shares, bufferFilled, null);
            } catch (RuntimeException e) {
                undo.rollback(e);
                throw e;
            }
        });
    }

    private void fillBuffer(Address asset, BigInteger amount, UndoLog undo) {
        if (amount.signum() > 0) {
            BufferFill fill = withdrawQueue.fillBuffer(self, asset, amount);
            undo.push(() -> withdrawQueue.revertFill(self, fill));
        }
    }

    // 只划转资产，池内记账由调用方在其余步骤都成功后执行
    private void moveToPool(OperatorPool pool, Address asset, BigInteger amount, UndoLog undo) {
        assetLedger.transfer(asset, self, pool.getAddress(), amount);
        undo.push(() -> assetLedger.transfer(asset, pool.getAddress(), self, amount));
    }

    private void checkNotPaused() {
        if (paused || riskFeed.isPaused(PauseFlag.DEPOSIT)) {
            throw new RestakeException(ErrorType.PAUSED, "deposit");
        }
    }

    private void checkTvlCap(TotalValues totals, BigInteger value) {
        if (maxDepositTvl.signum() > 0 && totals.getGrandTotal().add(value).compareTo(maxDepositTvl) > 0) {
            throw new RestakeException(ErrorType.MAX_TVL_REACHED,
                    "tvl=" + totals.getGrandTotal() + " value=" + value + " max=" + maxDepositTvl);
        }
    }

    // ---------------------------------- 管理 ----------------------------------

    @Override
    @RequiresRole(Role.RESTAKE_MANAGER_ADMIN)
    public void addCollateralAsset(Address caller, CollateralAsset asset) {
        if (asset == null) {
            throw new RestakeException(ErrorType.INVALID_ZERO_INPUT, "asset");
        }
        requireNonZero(asset.getAddress(), "asset");
        requireNonNegative(asset.getValueCap(), "valueCap");
        guard.run(() -> {
            if (asset.getAddress().isNative()) {
                throw new RestakeException(ErrorType.UNSUPPORTED_ASSET, "原生币不是抵押资产");
            }
            if (asset.getDecimals() != SUPPORTED_DECIMALS) {
                throw new RestakeException(ErrorType.INVALID_TOKEN_DECIMALS, "decimals=" + asset.getDecimals());
            }
            if (!priceOracle.hasPriceFeed(asset.getAddress())) {
                throw new RestakeException(ErrorType.NOT_FOUND, "资产没有价格源: " + asset.getAddress());
            }
            assetRegistry.add(asset);
            recordConfigChange(caller, "addCollateralAsset " + asset.getAddress());
        });
    }

    @Override
    @RequiresRole(Role.RESTAKE_MANAGER_ADMIN)
    public void removeCollateralAsset(Address caller, Address asset) {
        requireNonZero(asset, "asset");
        guard.run(() -> {
            assetRegistry.get(asset);
            for (OperatorDelegate delegate : delegateRegistry.list()) {
                if (delegate.getPool().balanceOf(asset).signum() > 0) {
                    throw new RestakeException(ErrorType.STILL_HOLDING_VALUE,
                            "委托 " + delegate.getAddress() + " 仍持有 " + asset);
                }
            }
            if (withdrawQueue.bufferState(asset).getBalance().signum() > 0) {
                throw new RestakeException(ErrorType.STILL_HOLDING_VALUE, "提现缓冲仍持有 " + asset);
            }
            assetRegistry.remove(asset);
            recordConfigChange(caller, "removeCollateralAsset " + asset);
        });
    }

    @Override
    @RequiresRole(Role.RESTAKE_MANAGER_ADMIN)
    public void setAssetValueCap(Address caller, Address asset, BigInteger cap) {
        requireNonNegative(cap, "cap");
        guard.run(() -> {
            CollateralAsset collateral = assetRegistry.get(asset);
            collateral.setValueCap(cap);
            recordConfigChange(caller, "assetValueCap " + asset + " -> " + cap);
        });
    }

    @Override
    @RequiresRole(Role.OPERATOR_DELEGATOR_ADMIN)
    public void addOperatorDelegate(Address caller, Address delegate, OperatorPool pool, int allocationBps) {
        requireNonZero(delegate, "delegate");
        requireBasisPoints(allocationBps, "allocationBps");
        if (pool == null) {
            throw new RestakeException(ErrorType.INVALID_ZERO_INPUT, "pool");
        }
        guard.run(() -> {
            delegateRegistry.add(new OperatorDelegate(delegate, allocationBps, pool));
            recordConfigChange(caller, "addOperatorDelegate " + delegate + " bps=" + allocationBps);
        });
    }

    @Override
    @RequiresRole(Role.OPERATOR_DELEGATOR_ADMIN)
    public void removeOperatorDelegate(Address caller, Address delegate) {
        guard.run(() -> {
            OperatorPool pool = delegateRegistry.get(delegate).getPool();
            boolean holding = pool.nativeStakedBalance().signum() > 0;
            for (Address asset : assetRegistry.addresses()) {
                holding = holding || pool.balanceOf(asset).signum() > 0;
            }
            if (holding) {
                throw new RestakeException(ErrorType.STILL_HOLDING_VALUE, "委托仍持有资产: " + delegate);
            }
            delegateRegistry.remove(delegate);
            recordConfigChange(caller, "removeOperatorDelegate " + delegate);
        });
    }

    @Override
    @RequiresRole(Role.OPERATOR_DELEGATOR_ADMIN)
    public void setOperatorDelegateAllocation(Address caller, Address delegate, int allocationBps) {
        requireBasisPoints(allocationBps, "allocationBps");
        guard.run(() -> {
            OperatorDelegate target = delegateRegistry.get(delegate);
            int old = target.getAllocationBps();
            target.setAllocationBps(allocationBps);
            recordConfigChange(caller, "allocation " + delegate + " " + old + " -> " + allocationBps);
        });
    }

    @Override
    @RequiresRole(Role.RESTAKE_MANAGER_ADMIN)
    public void setMaxDepositTvl(Address caller, BigInteger maxDepositTvl) {
        requireNonNegative(maxDepositTvl, "maxDepositTvl");
        guard.run(() -> {
            this.maxDepositTvl = maxDepositTvl;
            recordConfigChange(caller, "maxDepositTvl -> " + maxDepositTvl);
        });
    }

    @Override
    @RequiresRole(Role.DEPOSIT_WITHDRAW_PAUSER)
    public void setPaused(Address caller, boolean paused) {
        guard.run(() -> {
            this.paused = paused;
            log.warn("deposits paused={} by {}", paused, caller);
            recordConfigChange(caller, "paused=" + paused);
        });
    }

    @Override
    public boolean isPaused() {
        return guard.read(() -> paused);
    }

    @Override
    public BigInteger getMaxDepositTvl() {
        return guard.read(() -> maxDepositTvl);
    }

    @Override
    public List<CollateralAsset> listCollateralAssets() {
        return guard.read(assetRegistry::list);
    }

    @Override
    public List<OperatorDelegate> listOperatorDelegates() {
        return guard.read(delegateRegistry::list);
    }

    // -------------------------------- 缓冲回补 --------------------------------

    @Override
    @RequiresRole(Role.OPERATOR_DELEGATOR_ADMIN)
    public RefillTicket initiateBufferRefill(Address caller, Address asset, BigInteger amount) {
        requireNonZero(asset, "asset");
        requirePositive(amount, "amount");
        return guard.call(() -> {
            if (!asset.isNative() && !assetRegistry.contains(asset)) {
                throw new RestakeException(ErrorType.UNSUPPORTED_ASSET, asset.toHex());
            }
            TotalValues totals = tvlCalculator.calculate();
            BigInteger value = priceOracle.lookupValue(asset, amount);
            OperatorDelegate source = delegateRegistry.get(DelegateSelector.chooseForWithdraw(delegateRegistry.list(),
                    totals.columnOf(asset), value, totals.getPerDelegatePerAsset(), totals.getPerDelegateTotal(),
                    totals.getGrandTotal()));
            long requestId = source.getPool().initiateWithdraw(asset, amount);

            RefillTicket ticket = new RefillTicket(source.getAddress(), asset, amount, requestId);
            refillBook.put(ticket);
            log.info("buffer refill initiated {}", ticket);
            eventRecorder.record(RestakeEvent.builder()
                    .type(EventType.REFILL_INITIATED)
                    .account(source.getAddress())
                    .asset(asset)
                    .amount(amount)
                    .requestId(requestId)
                    .build());
            return ticket.copy();
        });
    }

    /**
     * 池取回的资产先补缓冲，余下重新放回原池（原生币进入暂存）
     * 放置失败时凭证保留并记下已收到的数量，重试时不再向池取回
     */
    @Override
    @RequiresRole(Role.OPERATOR_DELEGATOR_ADMIN)
    public BigInteger completeBufferRefill(Address caller, Address delegate, long requestId) {
        return guard.call(() -> {
            RefillTicket ticket = refillBook.get(delegate, requestId);
            if (ticket == null) {
                throw new RestakeException(ErrorType.NOT_FOUND, "回补请求不存在: " + RefillBook.key(delegate, requestId));
            }
            OperatorDelegate source = delegateRegistry.get(delegate);
            Address asset = ticket.getAsset();

            if (!ticket.hasProceeds()) {
                ticket.setReceived(source.getPool().completeWithdraw(requestId));
            }
            BigInteger received = ticket.getReceived();

            BigInteger toBuffer = min(received, withdrawQueue.withdrawDeficit(asset));
            BigInteger surplus = received.subtract(toBuffer);
            UndoLog undo = new UndoLog();
            try {
                fillBuffer(asset, toBuffer, undo);
                if (surplus.signum() > 0) {
                    if (asset.isNative()) {
                        depositQueue.stage(self, surplus);
                    } else {
                        OperatorPool pool = source.getPool();
                        moveToPool(pool, asset, surplus, undo);
                        pool.deposit(asset, surplus);
                    }
                }
            } catch (RuntimeException e) {
                log.warn("buffer refill delegate={} request={} not placed, {} held on ticket: {}",
                        delegate, requestId, received, e.getMessage());
                undo.rollback(e);
                throw e;
            }
            refillBook.remove(delegate, requestId);

            log.info("buffer refill completed delegate={} request={} received={} buffer={} surplus={}",
                    delegate, requestId, received, toBuffer, surplus);
            eventRecorder.record(RestakeEvent.builder()
                    .type(EventType.REFILL_COMPLETED)
                    .account(delegate)
                    .asset(asset)
                    .amount(toBuffer)
                    .requestId(requestId)
                    .detail("received=" + received)
                    .build());
            return toBuffer;
        });
    }

    @Override
    public List<RefillTicket> pendingRefills() {
        return guard.read(refillBook::list);
    }

    private void recordConfigChange(Address caller, String detail) {
        log.info("config change by {}: {}", caller, detail);
        eventRecorder.record(RestakeEvent.builder()
                .type(EventType.CONFIG_CHANGED)
                .account(caller)
                .detail("AccountingCore " + detail)
                .build());
    }
}
