package com.bit.restake.token;

import com.bit.restake.common.Address;

import java.math.BigInteger;

/**
 * 份额代币（外部协作方）：转账/暂停机制不在核心范围内
 * 铸造只由记账核心调用，销毁只由提现队列调用
 */
public interface ShareToken {

    BigInteger totalSupply();

    BigInteger balanceOf(Address holder);

    void mint(Address to, BigInteger amount);

    void burn(Address from, BigInteger amount);

    void transfer(Address from, Address to, BigInteger amount);
}
