package com.bit.restake.oracle;

import com.bit.restake.common.Address;
import com.bit.restake.structure.price.PriceData;

/**
 * 价格源（外部协作方），过期窗口由核心持有
 */
public interface PriceFeed {

    PriceData latestPrice(Address asset);
}
