package com.bit.restake.structure.dto;

import com.bit.restake.common.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 从运营商池取回资产回补提现缓冲的凭证
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RefillTicket {
    private Address delegate;
    private Address asset;
    private BigInteger amount;
    private long requestId;
    /** 池已付出但尚未放入缓冲的数量，池取回完成前为 null */
    private BigInteger received;

    public RefillTicket(Address delegate, Address asset, BigInteger amount, long requestId) {
        this(delegate, asset, amount, requestId, null);
    }

    public boolean hasProceeds() {
        return received != null;
    }

    public RefillTicket copy() {
        return new RefillTicket(delegate, asset, amount, requestId, received);
    }
}
