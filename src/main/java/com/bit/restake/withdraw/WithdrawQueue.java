package com.bit.restake.withdraw;

import com.bit.restake.common.Address;
import com.bit.restake.structure.buffer.BufferFill;
import com.bit.restake.structure.buffer.BufferState;
import com.bit.restake.structure.withdraw.PendingPayout;
import com.bit.restake.structure.withdraw.WithdrawRequest;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

/**
 * 提现队列：份额锁定、缓冲准入/排队、冷却期领取
 */
public interface WithdrawQueue {

    /**
     * 托管地址：锁定的份额与缓冲资产都在这里
     */
    Address getAddress();

    /**
     * 发起提现：锁定份额，按当前净值计算赎回数量
     * 缓冲足够则全额预留，否则预留可用部分并排队
     */
    WithdrawRequest withdraw(Address user, BigInteger shares, Address asset);

    /**
     * 回补缓冲（仅存款流程）：先补排队负债，剩余计入可用缓冲
     */
    BufferFill fillBuffer(Address caller, Address asset, BigInteger amount);

    /**
     * 撤回刚完成的回补，资产退回回补方
     * 缓冲在回补之后有任何变动则拒绝
     */
    void revertFill(Address caller, BufferFill fill);

    /**
     * 冷却期后领取，按当前净值重算，只降不升
     */
    PendingPayout claim(int requestIndex, Address user);

    /**
     * 即时通道：同一次调用内完成提现和领取，跳过冷却期
     * 手续费付给 feeRecipient，其余付给用户，任一划转失败整体恢复
     */
    PendingPayout instantRedeem(Address caller, Address user, BigInteger shares, Address asset, int feeBps,
                                Address feeRecipient);

    BigInteger availableToWithdraw(Address asset);

    /**
     * 缓冲缺口 + 排队负债
     */
    BigInteger withdrawDeficit(Address asset);

    /**
     * 按当前净值报价，单位为资产数量
     */
    BigInteger quoteRedeem(BigInteger shares, Address asset);

    BufferState bufferState(Address asset);

    List<WithdrawRequest> withdrawRequests(Address user);

    Duration effectiveCooldown();

    void setBufferTarget(Address caller, Address asset, BigInteger target);

    void setCooldown(Address caller, long cooldownSeconds);

    void setPaused(Address caller, boolean paused);

    boolean isPaused();
}
