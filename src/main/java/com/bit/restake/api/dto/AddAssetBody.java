package com.bit.restake.api.dto;

import com.bit.restake.common.Address;
import lombok.Data;

import java.math.BigInteger;

@Data
public class AddAssetBody {
    private Address asset;
    private String priceFeedRef;
    private int decimals = 18;
    private BigInteger valueCap = BigInteger.ZERO;
}
