package com.bit.restake.structure.price;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceData {
    /** 每单位资产对应的原生币价值（18位精度） */
    private BigInteger price;
    /** 更新时间（秒） */
    private long timestamp;
}
