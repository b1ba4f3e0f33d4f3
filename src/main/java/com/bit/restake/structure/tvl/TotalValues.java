package com.bit.restake.structure.tvl;

import com.bit.restake.common.Address;
import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;
import java.util.List;

/**
 * 一次 TVL 计算的快照
 * perDelegatePerAsset[i][j]：第i个运营商委托持有第j列资产的价值，最后一列为原生质押
 */
@Getter
@ToString
public class TotalValues {

    private final List<Address> columns;
    private final List<Address> delegates;
    private final List<List<BigInteger>> perDelegatePerAsset;
    private final List<BigInteger> perDelegateTotal;
    /** 提现缓冲中持有的价值 */
    private final BigInteger bufferValue;
    /** 存款队列中尚未质押的原生币 */
    private final BigInteger stagedValue;
    /** 已从池取回、尚未放回缓冲或池的价值 */
    private final BigInteger refillValue;
    private final BigInteger grandTotal;

    public TotalValues(List<Address> columns, List<Address> delegates, List<List<BigInteger>> perDelegatePerAsset,
                       List<BigInteger> perDelegateTotal, BigInteger bufferValue, BigInteger stagedValue,
                       BigInteger refillValue) {
        this.columns = ImmutableList.copyOf(columns);
        this.delegates = ImmutableList.copyOf(delegates);
        ImmutableList.Builder<List<BigInteger>> rows = ImmutableList.builder();
        for (List<BigInteger> row : perDelegatePerAsset) {
            rows.add(ImmutableList.copyOf(row));
        }
        this.perDelegatePerAsset = rows.build();
        this.perDelegateTotal = ImmutableList.copyOf(perDelegateTotal);
        this.bufferValue = bufferValue;
        this.stagedValue = stagedValue;
        this.refillValue = refillValue;
        BigInteger total = bufferValue.add(stagedValue).add(refillValue);
        for (BigInteger value : perDelegateTotal) {
            total = total.add(value);
        }
        this.grandTotal = total;
    }

    public int columnOf(Address asset) {
        int column = columns.indexOf(asset);
        if (column < 0) {
            throw new RestakeException(ErrorType.NOT_FOUND, "资产不在TVL中: " + asset);
        }
        return column;
    }

    public int nativeColumn() {
        return columns.size() - 1;
    }

    /**
     * 某列资产在全部运营商委托中的价值合计
     */
    public BigInteger columnTotal(int column) {
        BigInteger total = BigInteger.ZERO;
        for (List<BigInteger> row : perDelegatePerAsset) {
            total = total.add(row.get(column));
        }
        return total;
    }
}
