package com.bit.restake;

import com.bit.restake.adapter.memory.MemoryAssetLedger;
import com.bit.restake.common.Address;

import java.math.BigInteger;
import java.util.function.BiPredicate;

/**
 * 满足条件的划转执行前先运行钩子，用于模拟收款方失败或重入
 */
public class HookedLedger extends MemoryAssetLedger {

    private BiPredicate<Address, Address> when;
    private Runnable hook;

    /**
     * hook 为 null 时清除
     */
    public void onTransfer(BiPredicate<Address, Address> when, Runnable hook) {
        this.when = when;
        this.hook = hook;
    }

    public void onPayout(Address from, Runnable hook) {
        onTransfer((f, t) -> f.equals(from), hook);
    }

    public void onReceive(Address to, Runnable hook) {
        onTransfer((f, t) -> t.equals(to), hook);
    }

    @Override
    public synchronized void transfer(Address asset, Address from, Address to, BigInteger amount) {
        if (hook != null && when.test(from, to)) {
            hook.run();
        }
        super.transfer(asset, from, to, amount);
    }
}
