package com.bit.restake.structure.buffer;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 单个资产的提现缓冲
 * available = balance - claimReserve，claimReserve 永远不超过 balance
 * queueToFill / queueFilled 只增不减，二者之差为尚未补足的排队负债
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BufferState {

    /** 缓冲目标大小，0 表示该资产不支持提现 */
    private BigInteger target = BigInteger.ZERO;

    /** 缓冲实际持有的资产 */
    private BigInteger balance = BigInteger.ZERO;

    /** 已承诺给未领取请求的部分 */
    private BigInteger claimReserve = BigInteger.ZERO;

    /** 累计排队需补足量 */
    private BigInteger queueToFill = BigInteger.ZERO;

    /** 累计已补足量 */
    private BigInteger queueFilled = BigInteger.ZERO;

    public BigInteger available() {
        return balance.subtract(claimReserve);
    }

    public BigInteger queueDeficit() {
        return queueToFill.subtract(queueFilled);
    }

    public BufferState copy() {
        return new BufferState(target, balance, claimReserve, queueToFill, queueFilled);
    }
}
