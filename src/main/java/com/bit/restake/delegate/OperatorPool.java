package com.bit.restake.delegate;

import com.bit.restake.common.Address;

import java.math.BigInteger;

/**
 * 运营商池适配器（外部协作方）
 * 封装单个运营商下的多个质押策略，余额实时查询，核心不缓存
 */
public interface OperatorPool {

    /**
     * 池地址，存款资产划转到该地址
     */
    Address getAddress();

    /**
     * 指定资产在策略中的余额（含已发起未完成的取回）
     */
    BigInteger balanceOf(Address asset);

    /**
     * 原生质押余额（验证者）
     */
    BigInteger nativeStakedBalance();

    /**
     * 存入已划转到池地址的资产
     * @return 策略份额
     */
    BigInteger deposit(Address asset, BigInteger amount);

    /**
     * 发起从策略取回
     * @return 取回请求ID
     */
    long initiateWithdraw(Address asset, BigInteger amount);

    /**
     * 完成取回，资产划转给池的所有者（记账核心）
     * @return 实际取回数量
     */
    BigInteger completeWithdraw(long requestId);
}
