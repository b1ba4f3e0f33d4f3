package com.bit.restake.util;

import com.bit.restake.common.Address;
import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;

import java.math.BigInteger;

public final class Validations {

    private Validations() {
    }

    public static Address requireNonZero(Address address, String name) {
        if (address == null || address.isZero()) {
            throw new RestakeException(ErrorType.INVALID_ZERO_INPUT, name + " 不能为零地址");
        }
        return address;
    }

    public static BigInteger requirePositive(BigInteger amount, String name) {
        if (amount == null || amount.signum() <= 0) {
            throw new RestakeException(ErrorType.INVALID_ZERO_INPUT, name + " 必须大于0");
        }
        return amount;
    }

    public static BigInteger requireNonNegative(BigInteger amount, String name) {
        if (amount == null || amount.signum() < 0) {
            throw new RestakeException(ErrorType.INVALID_ZERO_INPUT, name + " 不能为负");
        }
        return amount;
    }

    public static int requireBasisPoints(int bps, String name) {
        if (bps < 0 || bps > 10_000) {
            throw new RestakeException(ErrorType.INVALID_BASIS_POINTS, name + " 必须在0到10000之间: " + bps);
        }
        return bps;
    }

    public static BigInteger min(BigInteger a, BigInteger b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
