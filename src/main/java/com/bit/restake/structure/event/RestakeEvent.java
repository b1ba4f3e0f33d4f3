package com.bit.restake.structure.event;

import com.bit.restake.common.Address;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestakeEvent {
    private long sequence;          // 事件序号，由记录器分配
    private EventType type;
    private Address account;
    private Address asset;
    private BigInteger amount;
    private BigInteger shares;
    private Long requestId;
    private String detail;
    private long timestamp;         // 秒
}
