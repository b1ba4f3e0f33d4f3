package com.bit.restake.structure.withdraw;

import com.bit.restake.common.Address;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawRequest {

    /** 单调递增的请求ID */
    private long id;

    private Address asset;

    /** 托管中锁定的份额，领取时销毁 */
    private BigInteger sharesLocked;

    /** 请求时计算的赎回数量（资产单位），领取时只降不升 */
    private BigInteger amountToRedeem;

    /** 创建时间（秒） */
    private long createdAt;

    // v2: 排队标记与补足水位
    private boolean queued;

    @Builder.Default
    private BigInteger fillAt = BigInteger.ZERO;

    // v3: 即时提现通道创建的请求
    private boolean instant;

    public WithdrawStatus getStatus() {
        return queued ? WithdrawStatus.QUEUED : WithdrawStatus.RESERVED;
    }

    public WithdrawRequest copy() {
        return new WithdrawRequest(id, asset, sharesLocked, amountToRedeem, createdAt, queued, fillAt, instant);
    }
}
