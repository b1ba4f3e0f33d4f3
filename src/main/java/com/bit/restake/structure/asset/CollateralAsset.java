package com.bit.restake.structure.asset;

import com.bit.restake.common.Address;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 抵押资产
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollateralAsset {

    /** 资产地址 */
    private Address address;

    /** 价格源引用（描述性，如喂价合约地址） */
    private String priceFeedRef;

    /** 精度，仅支持18位 */
    @Builder.Default
    private int decimals = 18;

    /** 单资产价值上限，0 表示不限 */
    @Builder.Default
    private BigInteger valueCap = BigInteger.ZERO;
}
