package com.bit.restake.oracle.impl;

import com.bit.restake.access.Role;
import com.bit.restake.aop.annotation.RequiresRole;
import com.bit.restake.common.Address;
import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import com.bit.restake.oracle.PriceFeed;
import com.bit.restake.oracle.PriceOracle;
import com.bit.restake.oracle.ShareMath;
import com.bit.restake.structure.price.PriceData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.bit.restake.common.RestakeConstants.MAX_TIME_WINDOW;
import static com.bit.restake.common.RestakeConstants.SCALE_FACTOR;
import static com.bit.restake.util.Validations.requireNonZero;

@Slf4j
@Service
public class PriceOracleImpl implements PriceOracle {

    private final Clock clock;

    // 资产 -> 价格源
    private final Map<Address, PriceFeed> priceFeeds = new ConcurrentHashMap<>();

    public PriceOracleImpl(Clock clock) {
        this.clock = clock;
    }

    @Override
    @RequiresRole(Role.ORACLE_ADMIN)
    public void setPriceFeed(Address caller, Address asset, PriceFeed feed) {
        requireNonZero(asset, "asset");
        if (feed == null) {
            throw new RestakeException(ErrorType.INVALID_ZERO_INPUT, "价格源为空");
        }
        if (asset.isNative()) {
            throw new RestakeException(ErrorType.INVALID_ZERO_INPUT, "原生币无需价格源");
        }
        // 设置前校验一次，拒绝无效或过期的价格源
        checkedPrice(asset, feed);
        priceFeeds.put(asset, feed);
        log.info("价格源已设置 asset={}", asset);
    }

    @Override
    public boolean hasPriceFeed(Address asset) {
        return asset.isNative() || priceFeeds.containsKey(asset);
    }

    @Override
    public BigInteger lookupValue(Address asset, BigInteger amount) {
        if (asset.isNative()) {
            return amount;
        }
        BigInteger price = checkedPrice(asset, feedOf(asset));
        return amount.multiply(price).divide(SCALE_FACTOR);
    }

    @Override
    public BigInteger lookupAmountFromValue(Address asset, BigInteger value) {
        if (asset.isNative()) {
            return value;
        }
        BigInteger price = checkedPrice(asset, feedOf(asset));
        return value.multiply(SCALE_FACTOR).divide(price);
    }

    @Override
    public BigInteger lookupTotalValue(List<Address> assets, List<BigInteger> amounts) {
        if (assets.size() != amounts.size()) {
            throw new RestakeException(ErrorType.MISMATCHED_ARRAY_LENGTHS,
                    "assets=" + assets.size() + " amounts=" + amounts.size());
        }
        BigInteger total = BigInteger.ZERO;
        for (int i = 0; i < assets.size(); i++) {
            total = total.add(lookupValue(assets.get(i), amounts.get(i)));
        }
        return total;
    }

    @Override
    public BigInteger calculateMintAmount(BigInteger currentValue, BigInteger newValue, BigInteger existingSupply) {
        return ShareMath.calculateMintAmount(currentValue, newValue, existingSupply);
    }

    @Override
    public BigInteger calculateRedeemAmount(BigInteger sharesBurned, BigInteger totalSupply, BigInteger currentValue) {
        return ShareMath.calculateRedeemAmount(sharesBurned, totalSupply, currentValue);
    }

    private PriceFeed feedOf(Address asset) {
        PriceFeed feed = priceFeeds.get(asset);
        if (feed == null) {
            throw new RestakeException(ErrorType.NOT_FOUND, "资产没有价格源: " + asset);
        }
        return feed;
    }

    private BigInteger checkedPrice(Address asset, PriceFeed feed) {
        PriceData data = feed.latestPrice(asset);
        if (data == null || data.getPrice() == null) {
            throw new RestakeException(ErrorType.INVALID_PRICE, "价格为空 asset=" + asset);
        }
        long now = clock.instant().getEpochSecond();
        if (data.getTimestamp() < now - MAX_TIME_WINDOW) {
            throw new RestakeException(ErrorType.ORACLE_STALE,
                    "asset=" + asset + " timestamp=" + data.getTimestamp() + " now=" + now);
        }
        if (data.getPrice().signum() <= 0) {
            throw new RestakeException(ErrorType.INVALID_PRICE, "asset=" + asset + " price=" + data.getPrice());
        }
        return data.getPrice();
    }
}
