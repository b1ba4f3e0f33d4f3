package com.bit.restake.adapter.memory;

import com.bit.restake.common.Address;
import com.bit.restake.oracle.PriceFeed;
import com.bit.restake.structure.price.PriceData;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 手工设置的价格源，不做任何校验（校验在预言机侧）
 */
@Component
public class MemoryPriceFeed implements PriceFeed {

    private final Map<Address, PriceData> prices = new ConcurrentHashMap<>();

    public void setPrice(Address asset, BigInteger price, long timestamp) {
        PriceData data = new PriceData();
        data.setPrice(price);
        data.setTimestamp(timestamp);
        prices.put(asset, data);
    }

    @Override
    public PriceData latestPrice(Address asset) {
        return prices.get(asset);
    }
}
