package com.bit.restake.accounting;

import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import com.bit.restake.structure.delegate.OperatorDelegate;

import java.math.BigInteger;
import java.util.List;

import static com.bit.restake.common.RestakeConstants.BASIS_POINTS;

/**
 * 运营商委托的负载均衡选择，O(n) 单次扫描
 */
public final class DelegateSelector {

    private DelegateSelector() {
    }

    /**
     * 存款：第一个价值占比低于分配目标的委托；都不满足时返回第一个
     * @return 委托下标
     */
    public static int chooseForDeposit(List<OperatorDelegate> delegates, List<BigInteger> perDelegateTotal,
                                       BigInteger grandTotal) {
        if (delegates.isEmpty()) {
            throw new RestakeException(ErrorType.NO_ELIGIBLE_DELEGATE, "没有运营商委托");
        }
        if (delegates.size() == 1 || grandTotal.signum() == 0) {
            return 0;
        }
        for (int i = 0; i < delegates.size(); i++) {
            BigInteger shareBps = perDelegateTotal.get(i).multiply(BASIS_POINTS).divide(grandTotal);
            if (shareBps.compareTo(BigInteger.valueOf(delegates.get(i).getAllocationBps())) < 0) {
                return i;
            }
        }
        return 0;
    }

    /**
     * 取回：第一轮优先选占比高于分配目标且该资产足够的委托（顺便再平衡）
     * 第二轮任意该资产足够的委托
     * @param value 需要取回的价值
     * @return 委托下标
     */
    public static int chooseForWithdraw(List<OperatorDelegate> delegates, int column, BigInteger value,
                                        List<List<BigInteger>> perDelegatePerAsset, List<BigInteger> perDelegateTotal,
                                        BigInteger grandTotal) {
        if (grandTotal.signum() > 0) {
            for (int i = 0; i < delegates.size(); i++) {
                BigInteger shareBps = perDelegateTotal.get(i).multiply(BASIS_POINTS).divide(grandTotal);
                boolean overAllocated = shareBps.compareTo(BigInteger.valueOf(delegates.get(i).getAllocationBps())) > 0;
                if (overAllocated && perDelegatePerAsset.get(i).get(column).compareTo(value) >= 0) {
                    return i;
                }
            }
        }
        for (int i = 0; i < delegates.size(); i++) {
            if (perDelegatePerAsset.get(i).get(column).compareTo(value) >= 0) {
                return i;
            }
        }
        throw new RestakeException(ErrorType.NO_ELIGIBLE_DELEGATE, "没有委托持有足够资产 value=" + value);
    }
}
