package com.bit.restake.api.dto;

import com.bit.restake.common.Address;
import lombok.Data;

import java.math.BigInteger;

@Data
public class WithdrawBody {
    private Address asset;
    private BigInteger shares;
    // 仅即时提现使用，为空视为0
    private BigInteger minOut;
}
