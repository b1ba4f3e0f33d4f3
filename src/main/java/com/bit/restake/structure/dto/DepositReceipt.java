package com.bit.restake.structure.dto;

import com.bit.restake.common.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DepositReceipt {
    private Address asset;
    private BigInteger amount;
    private BigInteger value;
    private BigInteger sharesMinted;
    /** 用于补足提现缓冲的部分 */
    private BigInteger bufferFilled;
    /** 接收剩余资产的运营商委托，原生币进入存款队列或全部补缓冲时为空 */
    private Address delegate;
}
