package com.bit.restake.structure.withdraw;

/**
 * 提现请求状态：OPEN -> (QUEUED | RESERVED) -> CLAIMED
 * 领取后请求被移除，CLAIMED 只出现在事件和回执中
 */
public enum WithdrawStatus {
    OPEN,
    /** 全额预留 */
    RESERVED,
    /** 部分或全部排队等待补足 */
    QUEUED,
    CLAIMED
}
