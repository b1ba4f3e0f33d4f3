package com.bit.restake.structure.buffer;

import com.bit.restake.common.Address;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * 一次回补的结果，撤回时用 *After 字段确认缓冲此后未被改动
 */
@Getter
@ToString
@AllArgsConstructor
public final class BufferFill {
    private final Address filler;
    private final Address asset;
    private final BigInteger amount;
    /** 其中用于补足排队负债的部分 */
    private final BigInteger queuePortion;
    private final BigInteger balanceAfter;
    private final BigInteger queueFilledAfter;
}
