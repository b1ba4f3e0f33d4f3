package com.bit.restake.token;

import com.bit.restake.common.Address;

import java.math.BigInteger;

/**
 * 抵押资产与原生币的账本（外部协作方），负责实际的资产划转
 * asset 为 {@link Address#NATIVE} 时表示原生币
 */
public interface AssetLedger {

    BigInteger balanceOf(Address asset, Address holder);

    /**
     * 划转资产，余额不足时抛出异常
     */
    void transfer(Address asset, Address from, Address to, BigInteger amount);
}
