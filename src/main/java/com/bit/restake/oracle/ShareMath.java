package com.bit.restake.oracle;

import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;

import java.math.BigInteger;

import static com.bit.restake.common.RestakeConstants.SCALE_FACTOR;

/**
 * 份额铸造/赎回的纯函数，全部为整数向下取整
 */
public final class ShareMath {

    private ShareMath() {
    }

    /**
     * 计算存入 newValue 后应铸造的份额
     * 冷启动（当前价值或供应量为0）时按 1:1 铸造
     * 否则 inflation = newValue / (currentValue + newValue)，newSupply = supply / (1 - inflation)
     */
    public static BigInteger calculateMintAmount(BigInteger currentValue, BigInteger newValue, BigInteger existingSupply) {
        if (currentValue.signum() == 0 || existingSupply.signum() == 0) {
            if (newValue.signum() <= 0) {
                throw new RestakeException(ErrorType.ZERO_MINT_AMOUNT, "新增价值为0");
            }
            return newValue;
        }
        BigInteger inflationPercentage = SCALE_FACTOR.multiply(newValue).divide(currentValue.add(newValue));
        BigInteger newSupply = existingSupply.multiply(SCALE_FACTOR).divide(SCALE_FACTOR.subtract(inflationPercentage));
        BigInteger mintAmount = newSupply.subtract(existingSupply);
        if (mintAmount.signum() <= 0) {
            throw new RestakeException(ErrorType.ZERO_MINT_AMOUNT,
                    "newValue=" + newValue + " currentValue=" + currentValue + " supply=" + existingSupply);
        }
        return mintAmount;
    }

    /**
     * 按比例赎回：currentValue * sharesBurned / totalSupply
     */
    public static BigInteger calculateRedeemAmount(BigInteger sharesBurned, BigInteger totalSupply, BigInteger currentValue) {
        if (totalSupply.signum() == 0) {
            throw new RestakeException(ErrorType.ZERO_REDEEM_AMOUNT, "份额总供应为0");
        }
        BigInteger redeemAmount = currentValue.multiply(sharesBurned).divide(totalSupply);
        if (redeemAmount.signum() <= 0) {
            throw new RestakeException(ErrorType.ZERO_REDEEM_AMOUNT,
                    "shares=" + sharesBurned + " supply=" + totalSupply + " value=" + currentValue);
        }
        return redeemAmount;
    }
}
