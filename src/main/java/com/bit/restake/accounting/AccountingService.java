package com.bit.restake.accounting;

import com.bit.restake.common.Address;
import com.bit.restake.delegate.OperatorPool;
import com.bit.restake.structure.asset.CollateralAsset;
import com.bit.restake.structure.delegate.OperatorDelegate;
import com.bit.restake.structure.dto.DepositReceipt;
import com.bit.restake.structure.dto.RefillTicket;
import com.bit.restake.structure.tvl.TotalValues;

import java.math.BigInteger;
import java.util.List;

/**
 * 记账核心：TVL 汇总、存款铸造份额、运营商委托路由
 */
public interface AccountingService {

    Address getAddress();

    /**
     * 实时 TVL：运营商委托 × 资产 矩阵 + 提现缓冲 + 存款队列暂存
     */
    TotalValues calculateTotalValues();

    OperatorDelegate chooseDelegateForDeposit(List<BigInteger> perDelegateTotal, BigInteger grandTotal);

    OperatorDelegate chooseDelegateForWithdraw(int assetIndex, BigInteger value, List<List<BigInteger>> perDelegatePerAsset,
                                               List<BigInteger> perDelegateTotal, BigInteger grandTotal);

    /**
     * 存入抵押资产：先补提现缓冲缺口，剩余转给选中的运营商委托，按存入价值铸造份额
     */
    DepositReceipt deposit(Address user, Address asset, BigInteger amount, long referralId);

    /**
     * 存入原生币：先补提现缓冲缺口，剩余进入存款队列暂存
     */
    DepositReceipt depositNative(Address user, BigInteger amount, long referralId);

    // ---------------------------------- 管理 ----------------------------------

    void addCollateralAsset(Address caller, CollateralAsset asset);

    void removeCollateralAsset(Address caller, Address asset);

    void setAssetValueCap(Address caller, Address asset, BigInteger cap);

    void addOperatorDelegate(Address caller, Address delegate, OperatorPool pool, int allocationBps);

    void removeOperatorDelegate(Address caller, Address delegate);

    void setOperatorDelegateAllocation(Address caller, Address delegate, int allocationBps);

    /**
     * 全局 TVL 上限，0 表示不限
     */
    void setMaxDepositTvl(Address caller, BigInteger maxDepositTvl);

    void setPaused(Address caller, boolean paused);

    boolean isPaused();

    BigInteger getMaxDepositTvl();

    List<CollateralAsset> listCollateralAssets();

    List<OperatorDelegate> listOperatorDelegates();

    // -------------------------------- 缓冲回补 --------------------------------

    /**
     * 从运营商池发起取回，用于回补提现缓冲
     */
    RefillTicket initiateBufferRefill(Address caller, Address asset, BigInteger amount);

    /**
     * 完成取回：补足提现缓冲缺口，多余部分重新存回原运营商池
     * @return 进入缓冲的数量
     */
    BigInteger completeBufferRefill(Address caller, Address delegate, long requestId);

    List<RefillTicket> pendingRefills();
}
