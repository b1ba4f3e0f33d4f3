package com.bit.restake.structure.dto;

import com.bit.restake.common.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InstantWithdrawReceipt {
    private long requestId;
    private Address asset;
    private BigInteger sharesBurned;
    private BigInteger grossAmount;
    private int feeBps;
    private BigInteger fee;
    private BigInteger netAmount;
}
