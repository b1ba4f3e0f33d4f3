package com.bit.restake.access;

public enum Role {
    RESTAKE_MANAGER_ADMIN,      // 抵押资产、TVL上限
    OPERATOR_DELEGATOR_ADMIN,   // 运营商委托增删、配比、缓冲回补
    ORACLE_ADMIN,               // 价格源
    WITHDRAW_QUEUE_ADMIN,       // 缓冲目标、冷却期
    INSTANT_WITHDRAW_ADMIN,     // 即时提现手续费
    DEPOSIT_WITHDRAW_PAUSER,    // 暂停/恢复
    NATIVE_STAKE_ADMIN,         // 待质押原生币转入运营商
    BUFFER_FILLER,              // 存款流程回补提现缓冲
    INSTANT_WITHDRAWER,         // 即时提现通道
    PRICE_RELAYER               // 跨链价格中继
}
