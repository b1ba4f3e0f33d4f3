package com.bit.restake.instant;

import com.bit.restake.common.Address;
import com.bit.restake.structure.dto.InstantWithdrawReceipt;
import com.bit.restake.structure.instant.InstantWithdrawConfig;

import java.math.BigInteger;

/**
 * 即时提现：直接从提现缓冲支付，跳过冷却期，收取随缓冲消耗递增的手续费
 */
public interface InstantWithdrawer {

    Address getAddress();

    InstantWithdrawReceipt withdraw(Address user, BigInteger shares, Address asset, BigInteger minOut);

    /**
     * 按当前状态预估，不执行
     */
    InstantWithdrawReceipt preview(BigInteger shares, Address asset);

    InstantWithdrawConfig getConfig();

    void setConfig(Address caller, InstantWithdrawConfig config);

    void setPaused(Address caller, boolean paused);

    boolean isPaused();
}
