package com.bit.restake.structure.instant;

import com.bit.restake.common.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InstantWithdrawConfig {

    /** 回撤下限：缓冲目标的基点比例，提现后可用缓冲不得低于它 */
    private int drawdownLimitBps;

    /** 缓冲未动用时的手续费 */
    private int minFeeBps;

    /** 缓冲降到下限时的手续费 */
    private int maxFeeBps;

    private Address feeDestination;
}
