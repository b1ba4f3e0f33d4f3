package com.bit.restake.accounting;

import com.bit.restake.common.Address;
import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import com.bit.restake.structure.delegate.OperatorDelegate;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DelegateSelectorTest {

    private static OperatorDelegate delegate(long index, int bps) {
        return new OperatorDelegate(Address.ofIndex(index), bps, null);
    }

    private static List<BigInteger> values(long... values) {
        return Arrays.stream(values).mapToObj(BigInteger::valueOf).toList();
    }

    @Test
    void depositPicksFirstUnderAllocated() {
        List<OperatorDelegate> delegates = List.of(delegate(1, 5000), delegate(2, 3000), delegate(3, 2000));
        // 占比 60% / 30% / 10%：第三个低于 20%
        assertEquals(2, DelegateSelector.chooseForDeposit(delegates, values(60, 30, 10), BigInteger.valueOf(100)));
        // 占比 40% 低于 50%，取第一个
        assertEquals(0, DelegateSelector.chooseForDeposit(delegates, values(40, 40, 20), BigInteger.valueOf(100)));
    }

    @Test
    void depositFallsBackToFirst() {
        List<OperatorDelegate> delegates = List.of(delegate(1, 5000), delegate(2, 5000));
        assertEquals(0, DelegateSelector.chooseForDeposit(delegates, values(50, 50), BigInteger.valueOf(100)));
        assertEquals(0, DelegateSelector.chooseForDeposit(delegates, values(0, 0), BigInteger.ZERO));
    }

    @Test
    void depositWithoutDelegatesFails() {
        RestakeException e = assertThrows(RestakeException.class,
                () -> DelegateSelector.chooseForDeposit(List.of(), List.of(), BigInteger.ZERO));
        assertEquals(ErrorType.NO_ELIGIBLE_DELEGATE, e.getErrorType());
    }

    @Test
    void withdrawPrefersOverAllocatedWithEnoughAsset() {
        List<OperatorDelegate> delegates = List.of(delegate(1, 5000), delegate(2, 5000));
        List<List<BigInteger>> matrix = List.of(values(30, 0), values(70, 0));
        // 第二个占 70% 高于 50%，且持有足够
        assertEquals(1, DelegateSelector.chooseForWithdraw(delegates, 0, BigInteger.valueOf(20), matrix,
                values(30, 70), BigInteger.valueOf(100)));
    }

    @Test
    void withdrawFallsBackToAnyWithEnoughAsset() {
        List<OperatorDelegate> delegates = List.of(delegate(1, 5000), delegate(2, 5000));
        List<List<BigInteger>> matrix = List.of(values(40, 0), values(60, 0));
        // 超配的第二个只有60，不够80；第二轮也没人够
        RestakeException e = assertThrows(RestakeException.class,
                () -> DelegateSelector.chooseForWithdraw(delegates, 0, BigInteger.valueOf(80), matrix,
                        values(40, 60), BigInteger.valueOf(100)));
        assertEquals(ErrorType.NO_ELIGIBLE_DELEGATE, e.getErrorType());

        // 没有超配的委托，第二轮取第一个足够的
        List<List<BigInteger>> skewed = List.of(values(45, 0), values(55, 0));
        assertEquals(0, DelegateSelector.chooseForWithdraw(List.of(delegate(1, 5000), delegate(2, 6000)), 0,
                BigInteger.valueOf(45), skewed, values(45, 55), BigInteger.valueOf(100)));
    }

    @Test
    void withdrawAtExactAllocationIsNotOverAllocated() {
        List<OperatorDelegate> delegates = List.of(delegate(1, 5000), delegate(2, 5000));
        List<List<BigInteger>> matrix = List.of(values(50, 0), values(50, 0));
        // 都恰好等于分配目标，第一轮不选，第二轮取第一个
        assertEquals(0, DelegateSelector.chooseForWithdraw(delegates, 0, BigInteger.valueOf(50), matrix,
                values(50, 50), BigInteger.valueOf(100)));
    }
}
