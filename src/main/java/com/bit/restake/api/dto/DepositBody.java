package com.bit.restake.api.dto;

import com.bit.restake.common.Address;
import lombok.Data;

import java.math.BigInteger;

@Data
public class DepositBody {
    private Address asset;          // 原生币存款时忽略
    private BigInteger amount;
    private long referralId;
}
