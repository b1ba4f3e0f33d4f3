package com.bit.restake.accounting;

import com.bit.restake.common.Address;
import com.bit.restake.oracle.PriceOracle;
import com.bit.restake.registry.AssetRegistry;
import com.bit.restake.registry.DelegateRegistry;
import com.bit.restake.storage.WithdrawQueueStorage;
import com.bit.restake.structure.buffer.BufferState;
import com.bit.restake.structure.delegate.OperatorDelegate;
import com.bit.restake.structure.dto.RefillTicket;
import com.bit.restake.structure.tvl.TotalValues;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * TVL 汇总：运营商委托 × 资产 的实时余额计价
 * 另加提现缓冲持有的资产、存款队列中未质押的原生币和回补途中的资产
 */
@Component
public class TvlCalculator {

    private final AssetRegistry assetRegistry;
    private final DelegateRegistry delegateRegistry;
    private final PriceOracle priceOracle;
    private final WithdrawQueueStorage withdrawStorage;
    private final DepositQueue depositQueue;
    private final RefillBook refillBook;

    public TvlCalculator(AssetRegistry assetRegistry, DelegateRegistry delegateRegistry, PriceOracle priceOracle,
                         WithdrawQueueStorage withdrawStorage, DepositQueue depositQueue, RefillBook refillBook) {
        this.assetRegistry = assetRegistry;
        this.delegateRegistry = delegateRegistry;
        this.priceOracle = priceOracle;
        this.withdrawStorage = withdrawStorage;
        this.depositQueue = depositQueue;
        this.refillBook = refillBook;
    }

    public TotalValues calculate() {
        List<Address> columns = new ArrayList<>(assetRegistry.addresses());
        columns.add(Address.NATIVE);

        List<OperatorDelegate> delegates = delegateRegistry.list();
        List<Address> delegateAddresses = new ArrayList<>(delegates.size());
        List<List<BigInteger>> perDelegatePerAsset = new ArrayList<>(delegates.size());
        List<BigInteger> perDelegateTotal = new ArrayList<>(delegates.size());

        for (OperatorDelegate delegate : delegates) {
            List<BigInteger> row = new ArrayList<>(columns.size());
            BigInteger delegateTotal = BigInteger.ZERO;
            for (int j = 0; j < columns.size() - 1; j++) {
                Address asset = columns.get(j);
                BigInteger balance = delegate.getPool().balanceOf(asset);
                BigInteger value = balance.signum() == 0 ? BigInteger.ZERO : priceOracle.lookupValue(asset, balance);
                row.add(value);
                delegateTotal = delegateTotal.add(value);
            }
            // 最后一列：原生质押
            BigInteger nativeStaked = delegate.getPool().nativeStakedBalance();
            row.add(nativeStaked);
            delegateTotal = delegateTotal.add(nativeStaked);

            delegateAddresses.add(delegate.getAddress());
            perDelegatePerAsset.add(row);
            perDelegateTotal.add(delegateTotal);
        }

        return new TotalValues(columns, delegateAddresses, perDelegatePerAsset, perDelegateTotal,
                bufferValue(), depositQueue.stagedBalance(), refillValue());
    }

    private BigInteger bufferValue() {
        BigInteger total = BigInteger.ZERO;
        for (Map.Entry<Address, BufferState> entry : withdrawStorage.getBuffers().entrySet()) {
            BigInteger balance = entry.getValue().getBalance();
            if (balance.signum() > 0) {
                total = total.add(priceOracle.lookupValue(entry.getKey(), balance));
            }
        }
        return total;
    }

    // 池已付出、未放入缓冲或重新委托的部分
    private BigInteger refillValue() {
        BigInteger total = BigInteger.ZERO;
        for (RefillTicket ticket : refillBook.received()) {
            if (ticket.getReceived().signum() > 0) {
                total = total.add(priceOracle.lookupValue(ticket.getAsset(), ticket.getReceived()));
            }
        }
        return total;
    }
}
