package com.bit.restake.oracle;

import com.bit.restake.common.Address;

import java.math.BigInteger;
import java.util.List;

public interface PriceOracle {

    /**
     * 资产数量折算为原生币价值
     * 价格过期抛 ORACLE_STALE，价格非正抛 INVALID_PRICE
     */
    BigInteger lookupValue(Address asset, BigInteger amount);

    /**
     * 原生币价值折算为资产数量
     */
    BigInteger lookupAmountFromValue(Address asset, BigInteger value);

    /**
     * 批量折算并求和，两个列表长度必须一致
     */
    BigInteger lookupTotalValue(List<Address> assets, List<BigInteger> amounts);

    BigInteger calculateMintAmount(BigInteger currentValue, BigInteger newValue, BigInteger existingSupply);

    BigInteger calculateRedeemAmount(BigInteger sharesBurned, BigInteger totalSupply, BigInteger currentValue);

    void setPriceFeed(Address caller, Address asset, PriceFeed feed);

    boolean hasPriceFeed(Address asset);
}
