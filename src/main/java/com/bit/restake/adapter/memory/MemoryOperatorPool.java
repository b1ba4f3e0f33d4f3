package com.bit.restake.adapter.memory;

import com.bit.restake.common.Address;
import com.bit.restake.delegate.OperatorPool;
import com.bit.restake.token.AssetLedger;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存运营商池：策略余额记账，取回完成时资产从池地址划给所有者
 * 已发起未完成的取回仍计入 balanceOf
 */
@Slf4j
public class MemoryOperatorPool implements OperatorPool {

    private final Address address;
    private final Address owner;
    private final AssetLedger assetLedger;

    private final Map<Address, BigInteger> strategyBalances = new ConcurrentHashMap<>();
    private volatile BigInteger nativeStaked = BigInteger.ZERO;

    private final AtomicLong nextWithdrawId = new AtomicLong(1);
    private final Map<Long, Pending> pending = new LinkedHashMap<>();

    public MemoryOperatorPool(Address address, Address owner, AssetLedger assetLedger) {
        this.address = address;
        this.owner = owner;
        this.assetLedger = assetLedger;
    }

    @Override
    public Address getAddress() {
        return address;
    }

    @Override
    public BigInteger balanceOf(Address asset) {
        return strategyBalances.getOrDefault(asset, BigInteger.ZERO);
    }

    @Override
    public BigInteger nativeStakedBalance() {
        return nativeStaked;
    }

    @Override
    public synchronized BigInteger deposit(Address asset, BigInteger amount) {
        if (asset.isNative()) {
            nativeStaked = nativeStaked.add(amount);
        } else {
            strategyBalances.merge(asset, amount, BigInteger::add);
        }
        log.debug("pool {} deposit {} {}", address, asset, amount);
        return amount;
    }

    @Override
    public synchronized long initiateWithdraw(Address asset, BigInteger amount) {
        BigInteger free = held(asset).subtract(pendingOf(asset));
        if (free.compareTo(amount) < 0) {
            throw new IllegalStateException("池余额不足 pool=" + address + " asset=" + asset
                    + " free=" + free + " amount=" + amount);
        }
        long id = nextWithdrawId.getAndIncrement();
        pending.put(id, new Pending(asset, amount));
        return id;
    }

    @Override
    public synchronized BigInteger completeWithdraw(long requestId) {
        Pending withdrawal = pending.get(requestId);
        if (withdrawal == null) {
            throw new IllegalStateException("取回请求不存在 pool=" + address + " id=" + requestId);
        }
        assetLedger.transfer(withdrawal.asset, address, owner, withdrawal.amount);
        pending.remove(requestId);
        adjust(withdrawal.asset, withdrawal.amount.negate());
        return withdrawal.amount;
    }

    /**
     * 模拟收益（正）或罚没（负），只改变策略记账
     */
    public synchronized void adjust(Address asset, BigInteger delta) {
        if (asset.isNative()) {
            nativeStaked = nativeStaked.add(delta);
        } else {
            strategyBalances.merge(asset, delta, BigInteger::add);
        }
    }

    private BigInteger held(Address asset) {
        return asset.isNative() ? nativeStaked : balanceOf(asset);
    }

    private BigInteger pendingOf(Address asset) {
        BigInteger total = BigInteger.ZERO;
        for (Pending p : pending.values()) {
            if (p.asset.equals(asset)) {
                total = total.add(p.amount);
            }
        }
        return total;
    }

    private static final class Pending {
        private final Address asset;
        private final BigInteger amount;

        private Pending(Address asset, BigInteger amount) {
            this.asset = asset;
            this.amount = amount;
        }
    }
}
