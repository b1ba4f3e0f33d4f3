package com.bit.restake.oracle.feed;

import com.bit.restake.RestakeFixture;
import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;

import static com.bit.restake.RestakeFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class BridgedPriceFeedTest {

    private RestakeFixture fixture;
    private BridgedPriceFeed feed;

    @BeforeEach
    void setUp() {
        fixture = new RestakeFixture();
        feed = fixture.bridgedFeed;
        feed.updatePrice(ADMIN, STETH, ether(1), fixture.now());
    }

    private RestakeException rejected(Runnable update) {
        return assertThrows(RestakeException.class, update::run);
    }

    @Test
    void acceptsUpdateWithinDeviation() {
        fixture.clock.advance(Duration.ofMinutes(10));
        // 默认最大偏离 500 bps
        BigInteger price = new BigInteger("1050000000000000000");
        feed.updatePrice(ADMIN, STETH, price, fixture.now());
        assertEquals(price, feed.latestPrice(STETH).getPrice());
        assertEquals(fixture.now(), feed.latestPrice(STETH).getTimestamp());
    }

    @Test
    void rejectsNonMonotonicAndFutureTimestamps() {
        long last = fixture.now();
        assertEquals(ErrorType.PRICE_UPDATE_REJECTED,
                rejected(() -> feed.updatePrice(ADMIN, STETH, ether(1), last)).getErrorType());
        assertEquals(ErrorType.PRICE_UPDATE_REJECTED,
                rejected(() -> feed.updatePrice(ADMIN, STETH, ether(1), last + 60)).getErrorType());
    }

    @Test
    void rejectsLargeDeviation() {
        fixture.clock.advance(Duration.ofMinutes(10));
        long now = fixture.now();
        assertEquals(ErrorType.PRICE_UPDATE_REJECTED,
                rejected(() -> feed.updatePrice(ADMIN, STETH, new BigInteger("1060000000000000000"), now)).getErrorType());
        assertEquals(ErrorType.INVALID_PRICE,
                rejected(() -> feed.updatePrice(ADMIN, STETH, BigInteger.ZERO, now)).getErrorType());
        assertEquals(ether(1), feed.latestPrice(STETH).getPrice());
    }

    @Test
    void onlyRelayerMayUpdate() {
        fixture.clock.advance(Duration.ofMinutes(1));
        long now = fixture.now();
        assertEquals(ErrorType.NOT_AUTHORIZED,
                rejected(() -> feed.updatePrice(MALLORY, STETH, ether(1), now)).getErrorType());
    }

    @Test
    void servesOracleLookups() {
        fixture.oracle.setPriceFeed(ADMIN, STETH, feed);
        assertEquals(ether(3), fixture.oracle.lookupValue(STETH, ether(3)));
        assertEquals(ErrorType.NOT_FOUND, rejected(() -> feed.latestPrice(CBETH)).getErrorType());
    }
}
