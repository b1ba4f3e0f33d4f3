package com.bit.restake.adapter.memory;

import com.bit.restake.common.Address;
import com.bit.restake.token.AssetLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存资产账本：资产 -> 持有人 -> 余额
 */
@Slf4j
@Component
public class MemoryAssetLedger implements AssetLedger {

    private final Map<Address, Map<Address, BigInteger>> balances = new ConcurrentHashMap<>();

    @Override
    public BigInteger balanceOf(Address asset, Address holder) {
        return balances.getOrDefault(asset, Map.of()).getOrDefault(holder, BigInteger.ZERO);
    }

    @Override
    public synchronized void transfer(Address asset, Address from, Address to, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("negative transfer " + amount);
        }
        BigInteger fromBalance = balanceOf(asset, from);
        if (fromBalance.compareTo(amount) < 0) {
            throw new IllegalStateException("余额不足 asset=" + asset + " holder=" + from
                    + " balance=" + fromBalance + " amount=" + amount);
        }
        Map<Address, BigInteger> holders = balances.computeIfAbsent(asset, a -> new ConcurrentHashMap<>());
        holders.put(from, fromBalance.subtract(amount));
        holders.merge(to, amount, BigInteger::add);
        log.debug("transfer {} {} -> {} amount={}", asset, from, to, amount);
    }

    /**
     * 凭空发行资产（测试和本地联调用）
     */
    public synchronized void mint(Address asset, Address to, BigInteger amount) {
        balances.computeIfAbsent(asset, a -> new ConcurrentHashMap<>()).merge(to, amount, BigInteger::add);
    }
}
