package com.bit.restake.structure.delegate;

import com.bit.restake.common.Address;
import com.bit.restake.delegate.OperatorPool;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 运营商委托：分配目标 + 运营商池适配器
 * 余额不在这里缓存，每次从池实时查询
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OperatorDelegate {

    private Address address;

    /** 分配目标（占总价值的基点），每个 ≤ 10000，合计不要求为 10000 */
    private int allocationBps;

    @ToString.Exclude
    private OperatorPool pool;
}
