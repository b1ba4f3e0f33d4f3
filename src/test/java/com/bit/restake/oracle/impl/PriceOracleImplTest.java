package com.bit.restake.oracle.impl;

import com.bit.restake.RestakeFixture;
import com.bit.restake.adapter.memory.MemoryPriceFeed;
import com.bit.restake.common.Address;
import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

import static com.bit.restake.RestakeFixture.*;
import static com.bit.restake.common.RestakeConstants.MAX_TIME_WINDOW;
import static org.junit.jupiter.api.Assertions.*;

public class PriceOracleImplTest {

    private RestakeFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new RestakeFixture();
        fixture.setPrice(STETH, new BigInteger("1050000000000000000"));
        fixture.oracle.setPriceFeed(ADMIN, STETH, fixture.priceFeed);
    }

    @Test
    void nativeIsIdentity() {
        assertEquals(ether(7), fixture.oracle.lookupValue(Address.NATIVE, ether(7)));
        assertEquals(ether(7), fixture.oracle.lookupAmountFromValue(Address.NATIVE, ether(7)));
        assertTrue(fixture.oracle.hasPriceFeed(Address.NATIVE));
    }

    @Test
    void pricedLookups() {
        assertEquals(new BigInteger("10500000000000000000"), fixture.oracle.lookupValue(STETH, ether(10)));
        assertEquals(ether(10), fixture.oracle.lookupAmountFromValue(STETH, new BigInteger("10500000000000000000")));
        assertEquals(new BigInteger("12500000000000000000"),
                fixture.oracle.lookupTotalValue(List.of(STETH, Address.NATIVE), List.of(ether(10), ether(2))));
    }

    @Test
    void mismatchedLengthsRejected() {
        RestakeException e = assertThrows(RestakeException.class,
                () -> fixture.oracle.lookupTotalValue(List.of(STETH), List.of(ether(1), ether(2))));
        assertEquals(ErrorType.MISMATCHED_ARRAY_LENGTHS, e.getErrorType());
    }

    @Test
    void staleAfterWindow() {
        // 恰好在窗口边界仍然有效
        fixture.clock.advance(Duration.ofSeconds(MAX_TIME_WINDOW));
        assertNotNull(fixture.oracle.lookupValue(STETH, ether(1)));

        fixture.clock.advance(Duration.ofSeconds(1));
        RestakeException e = assertThrows(RestakeException.class, () -> fixture.oracle.lookupValue(STETH, ether(1)));
        assertEquals(ErrorType.ORACLE_STALE, e.getErrorType());
    }

    @Test
    void nonPositivePriceRejected() {
        fixture.priceFeed.setPrice(STETH, BigInteger.ZERO, fixture.now());
        RestakeException e = assertThrows(RestakeException.class, () -> fixture.oracle.lookupValue(STETH, ether(1)));
        assertEquals(ErrorType.INVALID_PRICE, e.getErrorType());
    }

    @Test
    void missingFeed() {
        RestakeException e = assertThrows(RestakeException.class, () -> fixture.oracle.lookupValue(CBETH, ether(1)));
        assertEquals(ErrorType.NOT_FOUND, e.getErrorType());
        assertFalse(fixture.oracle.hasPriceFeed(CBETH));
    }

    @Test
    void setPriceFeedGuards() {
        RestakeException auth = assertThrows(RestakeException.class,
                () -> fixture.oracle.setPriceFeed(MALLORY, CBETH, fixture.priceFeed));
        assertEquals(ErrorType.NOT_AUTHORIZED, auth.getErrorType());

        RestakeException zero = assertThrows(RestakeException.class,
                () -> fixture.oracle.setPriceFeed(ADMIN, Address.ZERO, fixture.priceFeed));
        assertEquals(ErrorType.INVALID_ZERO_INPUT, zero.getErrorType());

        // 过期的价格源不能设置
        MemoryPriceFeed staleFeed = new MemoryPriceFeed();
        staleFeed.setPrice(CBETH, ether(1), fixture.now() - MAX_TIME_WINDOW - 1);
        RestakeException stale = assertThrows(RestakeException.class,
                () -> fixture.oracle.setPriceFeed(ADMIN, CBETH, staleFeed));
        assertEquals(ErrorType.ORACLE_STALE, stale.getErrorType());
        assertFalse(fixture.oracle.hasPriceFeed(CBETH));
    }
}
