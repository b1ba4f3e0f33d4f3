package com.bit.restake.common;

import java.math.BigInteger;

public final class RestakeConstants {

    private RestakeConstants() {
    }

    // 价值统一按18位精度计价
    public static final BigInteger SCALE_FACTOR = BigInteger.TEN.pow(18);

    // 基点分母 10000 = 100%
    public static final BigInteger BASIS_POINTS = BigInteger.valueOf(10_000);
    public static final int MAX_BASIS_POINTS = 10_000;

    /**
     * 价格最大允许时延（秒）：1天 + 60秒
     */
    public static final long MAX_TIME_WINDOW = 86_400L + 60L;

    /**
     * 单个验证者质押额 32 ether
     */
    public static final BigInteger VALIDATOR_DEPOSIT = BigInteger.valueOf(32).multiply(SCALE_FACTOR);

    // 支持的抵押资产精度
    public static final int SUPPORTED_DECIMALS = 18;
}
