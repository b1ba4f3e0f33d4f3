package com.bit.restake.exception;

import static com.bit.restake.exception.ErrorCategory.*;

public enum ErrorType {
    // 输入错误
    INVALID_ZERO_INPUT(INPUT, "输入为零（零地址或零数量）"),
    MISMATCHED_ARRAY_LENGTHS(INPUT, "数组长度不一致"),
    INVALID_BASIS_POINTS(INPUT, "基点参数越界"),
    INVALID_TOKEN_DECIMALS(INPUT, "资产精度不受支持"),
    INVALID_FEE_CONFIG(INPUT, "即时提现手续费配置无效"),

    // 状态错误
    ALREADY_ADDED(STATE, "已注册"),
    NOT_FOUND(STATE, "未找到"),
    ALREADY_SET(STATE, "值已设置"),
    INVALID_REQUEST_INDEX(STATE, "提现请求下标不存在"),
    UNSUPPORTED_ASSET(STATE, "资产不支持提现"),
    PAUSED(STATE, "功能已暂停"),
    REENTRANT_CALL(STATE, "检测到重入调用"),
    STILL_HOLDING_VALUE(STATE, "仍持有价值，不能移除"),
    UNSUPPORTED_SCHEMA_VERSION(STATE, "存储版本不受支持"),

    // 经济保护
    MAX_TVL_REACHED(ECONOMIC_GUARD, "超过全局TVL上限"),
    MAX_ASSET_TVL_REACHED(ECONOMIC_GUARD, "超过单资产TVL上限"),
    ORACLE_STALE(ECONOMIC_GUARD, "预言机价格已过期"),
    INVALID_PRICE(ECONOMIC_GUARD, "预言机价格无效"),
    PRICE_UPDATE_REJECTED(ECONOMIC_GUARD, "价格更新被拒绝"),
    ZERO_MINT_AMOUNT(ECONOMIC_GUARD, "铸造份额为零"),
    ZERO_REDEEM_AMOUNT(ECONOMIC_GUARD, "赎回数量为零"),
    NO_ELIGIBLE_DELEGATE(ECONOMIC_GUARD, "没有满足条件的运营商委托"),
    INSUFFICIENT_COLLATERAL(ECONOMIC_GUARD, "系统抵押不足以满足提现"),
    INSUFFICIENT_BUFFER(ECONOMIC_GUARD, "提现缓冲不足"),
    INSUFFICIENT_SHARES(ECONOMIC_GUARD, "份额余额不足"),
    INSUFFICIENT_STAGED_BALANCE(ECONOMIC_GUARD, "待质押余额不足"),
    BELOW_DRAWDOWN_FLOOR(ECONOMIC_GUARD, "低于缓冲回撤下限"),
    MIN_OUT_NOT_MET(ECONOMIC_GUARD, "到账数量低于最小值"),
    EARLY_CLAIM(ECONOMIC_GUARD, "冷却期未结束"),
    QUEUED_WITHDRAWAL_NOT_FILLED(ECONOMIC_GUARD, "排队提现尚未补足"),

    // 权限
    NOT_AUTHORIZED(AUTHORIZATION, "缺少角色权限");

    private final ErrorCategory category;
    private final String desc;

    ErrorType(ErrorCategory category, String desc) {
        this.category = category;
        this.desc = desc;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getDesc() {
        return desc;
    }
}
