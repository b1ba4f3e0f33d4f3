package com.bit.restake.oracle.feed;

import com.bit.restake.access.Role;
import com.bit.restake.aop.annotation.RequiresRole;
import com.bit.restake.common.Address;
import com.bit.restake.config.RestakeConfig;
import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import com.bit.restake.oracle.PriceFeed;
import com.bit.restake.structure.price.PriceData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.bit.restake.common.RestakeConstants.BASIS_POINTS;
import static com.bit.restake.util.Validations.requireNonZero;

/**
 * 远端部署的价格源：价格由跨链中继单向推送
 * 拒绝非单调时间戳、未来时间戳、以及偏离上次价格超过 maxDeviationBps 的更新
 */
@Slf4j
@Component
public class BridgedPriceFeed implements PriceFeed {

    private final Clock clock;
    private final RestakeConfig config;
    private final Map<Address, PriceData> prices = new ConcurrentHashMap<>();

    public BridgedPriceFeed(Clock clock, RestakeConfig config) {
        this.clock = clock;
        this.config = config;
    }

    @RequiresRole(Role.PRICE_RELAYER)
    public void updatePrice(Address caller, Address asset, BigInteger price, long timestamp) {
        requireNonZero(asset, "asset");
        if (price == null || price.signum() <= 0) {
            throw new RestakeException(ErrorType.INVALID_PRICE, "price=" + price);
        }
        long now = clock.instant().getEpochSecond();
        if (timestamp > now) {
            throw new RestakeException(ErrorType.PRICE_UPDATE_REJECTED, "未来时间戳 " + timestamp + " > " + now);
        }
        PriceData last = prices.get(asset);
        if (last != null) {
            if (timestamp <= last.getTimestamp()) {
                throw new RestakeException(ErrorType.PRICE_UPDATE_REJECTED,
                        "时间戳未递增 " + timestamp + " <= " + last.getTimestamp());
            }
            BigInteger diff = price.subtract(last.getPrice()).abs();
            BigInteger maxDiff = last.getPrice().multiply(BigInteger.valueOf(config.getBridge().getMaxDeviationBps()))
                    .divide(BASIS_POINTS);
            if (diff.compareTo(maxDiff) > 0) {
                throw new RestakeException(ErrorType.PRICE_UPDATE_REJECTED,
                        "价格偏离过大 last=" + last.getPrice() + " new=" + price);
            }
        }
        prices.put(asset, new PriceData(price, timestamp));
        log.debug("price updated asset={} price={} ts={}", asset, price, timestamp);
    }

    @Override
    public PriceData latestPrice(Address asset) {
        PriceData data = prices.get(asset);
        if (data == null) {
            throw new RestakeException(ErrorType.NOT_FOUND, "没有价格 asset=" + asset);
        }
        return new PriceData(data.getPrice(), data.getTimestamp());
    }
}
