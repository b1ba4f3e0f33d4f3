package com.bit.restake.structure.withdraw;

import com.bit.restake.common.Address;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * 领取时已提交完内部状态的待支付结果，之后才执行外部划转
 */
@Getter
@ToString
@AllArgsConstructor
public final class PendingPayout {
    private final long requestId;
    private final Address recipient;
    private final Address asset;
    private final BigInteger amount;
    private final BigInteger sharesBurned;
    /** 请求时承诺的数量，amount 只可能小于等于它 */
    private final BigInteger originalAmount;
    /** 从 amount 中扣下付给 feeRecipient 的部分，普通领取为 0 */
    private final BigInteger fee;
    private final Address feeRecipient;

    public BigInteger netAmount() {
        return amount.subtract(fee);
    }
}
