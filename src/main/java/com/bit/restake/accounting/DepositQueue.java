package com.bit.restake.accounting;

import com.bit.restake.common.Address;

import java.math.BigInteger;

/**
 * 原生币暂存区：原生币需由质押层凑成固定大小的验证者存款，先在这里暂存
 */
public interface DepositQueue {

    Address getAddress();

    /**
     * 尚未质押的原生币
     */
    BigInteger stagedBalance();

    /**
     * 从 from 划入原生币暂存
     */
    void stage(Address from, BigInteger amount);

    /**
     * 把 validatorCount * 32 ether 转给指定运营商委托的池
     * @return 实际转出的数量
     */
    BigInteger stakeStagedNative(Address caller, Address delegate, int validatorCount);
}
