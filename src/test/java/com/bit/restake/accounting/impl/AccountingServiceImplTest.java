package com.bit.restake.accounting.impl;

import com.bit.restake.HookedLedger;
import com.bit.restake.RestakeFixture;
import com.bit.restake.access.Role;
import com.bit.restake.adapter.memory.MemoryOperatorPool;
import com.bit.restake.common.Address;
import com.bit.restake.exception.ErrorType;
import com.bit.restake.exception.RestakeException;
import com.bit.restake.risk.PauseFlag;
import com.bit.restake.structure.asset.CollateralAsset;
import com.bit.restake.structure.dto.DepositReceipt;
import com.bit.restake.structure.dto.RefillTicket;
import com.bit.restake.structure.event.EventType;
import com.bit.restake.structure.tvl.TotalValues;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.math.BigInteger;
import java.util.List;

import static com.bit.restake.RestakeFixture.*;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class AccountingServiceImplTest {

    private RestakeFixture fixture;
    private MemoryOperatorPool pool1;

    @BeforeEach
    void setUp() {
        fixture = new RestakeFixture();
        fixture.addAsset(STETH, ETHER);
        pool1 = fixture.addDelegate(OD1, 10_000);
        fixture.fund(STETH, ALICE, ether(1_000));
        fixture.fund(STETH, BOB, ether(1_000));
        fixture.fund(Address.NATIVE, ALICE, ether(1_000));
    }

    private static ErrorType errorOf(Executable call) {
        return assertThrows(RestakeException.class, call).getErrorType();
    }

    @Test
    void bootstrapDepositMintsOneToOne() {
        DepositReceipt receipt = fixture.accounting.deposit(ALICE, STETH, ether(10), 7L);

        assertEquals(ether(10), receipt.getSharesMinted());
        assertEquals(ether(10), fixture.shareToken.balanceOf(ALICE));
        assertEquals(OD1, receipt.getDelegate());
        assertEquals(ether(10), pool1.balanceOf(STETH));
        assertEquals(ether(10), fixture.ledger.balanceOf(STETH, OD1));
        assertEquals(ether(990), fixture.ledger.balanceOf(STETH, ALICE));
        assertEquals(EventType.DEPOSIT, fixture.events.recent(1).get(0).getType());
    }

    @Test
    void secondDepositMintsProportionally() {
        fixture.accounting.deposit(ALICE, STETH, ether(100), 0L);
        DepositReceipt receipt = fixture.accounting.deposit(BOB, STETH, ether(50), 0L);

        assertEquals(new BigInteger("49999999999999999925"), receipt.getSharesMinted());
        assertEquals(ether(150), fixture.accounting.calculateTotalValues().getGrandTotal());
    }

    @Test
    void depositValueFollowsPrice() {
        fixture.accounting.deposit(ALICE, STETH, ether(10), 0L);
        fixture.setPrice(STETH, ETHER.multiply(BigInteger.TWO));

        TotalValues totals = fixture.accounting.calculateTotalValues();
        assertEquals(ether(20), totals.getGrandTotal());
        assertEquals(ether(20), totals.getPerDelegateTotal().get(0));
        assertEquals(ether(20), totals.getPerDelegatePerAsset().get(0).get(totals.columnOf(STETH)));
    }

    @Test
    void globalCapRejectsWithoutSideEffects() {
        fixture.accounting.setMaxDepositTvl(ADMIN, ether(50));
        assertEquals(ether(50), fixture.accounting.getMaxDepositTvl());
        fixture.accounting.deposit(ALICE, STETH, ether(40), 0L);

        assertEquals(ErrorType.MAX_TVL_REACHED, errorOf(() -> fixture.accounting.deposit(BOB, STETH, ether(20), 0L)));
        assertEquals(ether(1_000), fixture.ledger.balanceOf(STETH, BOB));
        assertEquals(BigInteger.ZERO, fixture.shareToken.balanceOf(BOB));

        // 恰好到上限可以存入
        fixture.accounting.deposit(BOB, STETH, ether(10), 0L);
        assertEquals(ether(50), fixture.accounting.calculateTotalValues().getGrandTotal());
    }

    @Test
    void assetCapIsPerAsset() {
        fixture.accounting.setAssetValueCap(ADMIN, STETH, ether(30));
        fixture.accounting.deposit(ALICE, STETH, ether(30), 0L);

        assertEquals(ErrorType.MAX_ASSET_TVL_REACHED,
                errorOf(() -> fixture.accounting.deposit(BOB, STETH, BigInteger.ONE, 0L)));
        // 原生币不受该资产上限约束
        fixture.accounting.depositNative(ALICE, ether(5), 0L);
        assertEquals(ether(35), fixture.accounting.calculateTotalValues().getGrandTotal());
    }

    @Test
    void depositRoutesToUnderAllocatedDelegate() {
        MemoryOperatorPool pool2 = fixture.addDelegate(OD2, 5_000);
        fixture.accounting.setOperatorDelegateAllocation(ADMIN, OD1, 5_000);

        // TVL 为0时选第一个
        assertEquals(OD1, fixture.accounting.deposit(ALICE, STETH, ether(10), 0L).getDelegate());
        // 第一个占 100%，第二个占 0%
        assertEquals(OD2, fixture.accounting.deposit(ALICE, STETH, ether(10), 0L).getDelegate());
        assertEquals(ether(10), pool2.balanceOf(STETH));
        // 都恰好 50%，回到第一个
        assertEquals(OD1, fixture.accounting.deposit(ALICE, STETH, ether(10), 0L).getDelegate());
    }

    @Test
    void delegateChoiceViews() {
        fixture.addDelegate(OD2, 4_000);
        fixture.accounting.setOperatorDelegateAllocation(ADMIN, OD1, 6_000);
        fixture.accounting.deposit(ALICE, STETH, ether(10), 0L);
        TotalValues totals = fixture.accounting.calculateTotalValues();

        // OD1 占 100% 不低于 60%，OD2 占 0% 低于 40%
        assertEquals(OD2, fixture.accounting.chooseDelegateForDeposit(totals.getPerDelegateTotal(),
                totals.getGrandTotal()).getAddress());
        // 取回优先选超配且持有足够的委托
        assertEquals(OD1, fixture.accounting.chooseDelegateForWithdraw(totals.columnOf(STETH), ether(5),
                totals.getPerDelegatePerAsset(), totals.getPerDelegateTotal(), totals.getGrandTotal()).getAddress());
        assertEquals(ErrorType.NO_ELIGIBLE_DELEGATE, errorOf(() -> fixture.accounting.chooseDelegateForWithdraw(
                totals.columnOf(STETH), ether(11), totals.getPerDelegatePerAsset(), totals.getPerDelegateTotal(),
                totals.getGrandTotal())));
    }

    @Test
    void slashingLowersShareValue() {
        fixture.accounting.deposit(ALICE, STETH, ether(100), 0L);
        pool1.adjust(STETH, ether(20).negate());
        assertEquals(ether(80), fixture.accounting.calculateTotalValues().getGrandTotal());

        // 净值缩水后同样价值换得更多份额
        DepositReceipt receipt = fixture.accounting.deposit(BOB, STETH, ether(80), 0L);
        assertEquals(ether(100), receipt.getSharesMinted());
        assertEquals(ether(160), fixture.accounting.calculateTotalValues().getGrandTotal());
    }

    @Test
    void depositFillsWithdrawBufferFirst() {
        fixture.withdrawQueue.setBufferTarget(ADMIN, STETH, ether(4));

        DepositReceipt receipt = fixture.accounting.deposit(ALICE, STETH, ether(10), 0L);

        assertEquals(ether(4), receipt.getBufferFilled());
        assertEquals(ether(6), pool1.balanceOf(STETH));
        assertEquals(ether(4), fixture.withdrawQueue.availableToWithdraw(STETH));
        assertEquals(BigInteger.ZERO, fixture.withdrawQueue.withdrawDeficit(STETH));
        // 缓冲中的资产计入 TVL
        assertEquals(ether(10), fixture.accounting.calculateTotalValues().getGrandTotal());

        // 缓冲吃掉全部存款时不路由到委托
        fixture.withdrawQueue.setBufferTarget(ADMIN, STETH, ether(20));
        DepositReceipt all = fixture.accounting.deposit(ALICE, STETH, ether(5), 0L);
        assertNull(all.getDelegate());
        assertEquals(ether(5), all.getBufferFilled());
    }

    @Test
    void nativeDepositStagesRemainder() {
        fixture.withdrawQueue.setBufferTarget(ADMIN, Address.NATIVE, ether(2));

        DepositReceipt receipt = fixture.accounting.depositNative(ALICE, ether(40), 0L);

        assertEquals(ether(2), receipt.getBufferFilled());
        assertEquals(ether(38), fixture.depositQueue.stagedBalance());
        assertEquals(ether(40), receipt.getSharesMinted());
        TotalValues totals = fixture.accounting.calculateTotalValues();
        assertEquals(ether(38), totals.getStagedValue());
        assertEquals(ether(2), totals.getBufferValue());
        assertEquals(ether(40), totals.getGrandTotal());
    }

    @Test
    void stakingStagedNativeKeepsTvl() {
        fixture.accounting.depositNative(ALICE, ether(40), 0L);

        assertEquals(ErrorType.INSUFFICIENT_STAGED_BALANCE,
                errorOf(() -> fixture.depositQueue.stakeStagedNative(ADMIN, OD1, 2)));
        assertEquals(ErrorType.NOT_AUTHORIZED,
                errorOf(() -> fixture.depositQueue.stakeStagedNative(MALLORY, OD1, 1)));

        assertEquals(ether(32), fixture.depositQueue.stakeStagedNative(ADMIN, OD1, 1));
        assertEquals(ether(8), fixture.depositQueue.stagedBalance());
        assertEquals(ether(32), pool1.nativeStakedBalance());
        TotalValues totals = fixture.accounting.calculateTotalValues();
        assertEquals(ether(40), totals.getGrandTotal());
        assertEquals(ether(32), totals.getPerDelegatePerAsset().get(0).get(totals.nativeColumn()));
    }

    @Test
    void pauseBlocksDeposits() {
        fixture.accounting.setPaused(ADMIN, true);
        assertEquals(ErrorType.PAUSED, errorOf(() -> fixture.accounting.deposit(ALICE, STETH, ether(1), 0L)));
        assertEquals(ErrorType.PAUSED, errorOf(() -> fixture.accounting.depositNative(ALICE, ether(1), 0L)));
        fixture.accounting.setPaused(ADMIN, false);

        // 风控参数源的暂停独立生效
        fixture.riskFeed.setPaused(PauseFlag.DEPOSIT, true);
        assertEquals(ErrorType.PAUSED, errorOf(() -> fixture.accounting.deposit(ALICE, STETH, ether(1), 0L)));
        fixture.riskFeed.setPaused(PauseFlag.DEPOSIT, false);
        fixture.accounting.deposit(ALICE, STETH, ether(1), 0L);

        assertEquals(ErrorType.NOT_AUTHORIZED, errorOf(() -> fixture.accounting.setPaused(MALLORY, true)));
    }

    @Test
    void depositInputValidation() {
        assertEquals(ErrorType.INVALID_ZERO_INPUT,
                errorOf(() -> fixture.accounting.deposit(ALICE, STETH, BigInteger.ZERO, 0L)));
        assertEquals(ErrorType.INVALID_ZERO_INPUT,
                errorOf(() -> fixture.accounting.deposit(Address.ZERO, STETH, ether(1), 0L)));
        assertEquals(ErrorType.NOT_FOUND,
                errorOf(() -> fixture.accounting.deposit(ALICE, CBETH, ether(1), 0L)));
    }

    @Test
    void depositWithoutDelegatesFails() {
        RestakeFixture empty = new RestakeFixture();
        empty.addAsset(STETH, ETHER);
        empty.fund(STETH, ALICE, ether(1));
        assertEquals(ErrorType.NO_ELIGIBLE_DELEGATE,
                errorOf(() -> empty.accounting.deposit(ALICE, STETH, ether(1), 0L)));
        assertEquals(ether(1), empty.ledger.balanceOf(STETH, ALICE));
    }

    @Test
    void collateralAssetAdministration() {
        assertEquals(ErrorType.NOT_AUTHORIZED, errorOf(() -> fixture.accounting.addCollateralAsset(MALLORY,
                CollateralAsset.builder().address(CBETH).build())));
        // 没有价格源
        assertEquals(ErrorType.NOT_FOUND, errorOf(() -> fixture.accounting.addCollateralAsset(ADMIN,
                CollateralAsset.builder().address(CBETH).build())));

        fixture.setPrice(CBETH, ETHER);
        fixture.oracle.setPriceFeed(ADMIN, CBETH, fixture.priceFeed);
        assertEquals(ErrorType.INVALID_TOKEN_DECIMALS, errorOf(() -> fixture.accounting.addCollateralAsset(ADMIN,
                CollateralAsset.builder().address(CBETH).decimals(6).build())));
        fixture.accounting.addCollateralAsset(ADMIN, CollateralAsset.builder().address(CBETH).build());
        assertEquals(ErrorType.ALREADY_ADDED, errorOf(() -> fixture.accounting.addCollateralAsset(ADMIN,
                CollateralAsset.builder().address(CBETH).build())));
        assertEquals(2, fixture.accounting.listCollateralAssets().size());

        fixture.accounting.deposit(ALICE, STETH, ether(1), 0L);
        assertEquals(ErrorType.STILL_HOLDING_VALUE,
                errorOf(() -> fixture.accounting.removeCollateralAsset(ADMIN, STETH)));
        fixture.accounting.removeCollateralAsset(ADMIN, CBETH);
        assertEquals(1, fixture.accounting.listCollateralAssets().size());
    }

    @Test
    void delegateAdministration() {
        assertEquals(ErrorType.INVALID_BASIS_POINTS, errorOf(() -> fixture.accounting.addOperatorDelegate(ADMIN, OD2,
                new MemoryOperatorPool(OD2, fixture.accounting.getAddress(), fixture.ledger), 10_001)));
        fixture.addDelegate(OD2, 0);
        assertEquals(ErrorType.ALREADY_ADDED, errorOf(() -> fixture.addDelegate(OD2, 0)));

        fixture.accounting.deposit(ALICE, STETH, ether(1), 0L);
        assertEquals(ErrorType.STILL_HOLDING_VALUE,
                errorOf(() -> fixture.accounting.removeOperatorDelegate(ADMIN, OD1)));
        fixture.accounting.removeOperatorDelegate(ADMIN, OD2);
        assertEquals(1, fixture.accounting.listOperatorDelegates().size());
        assertEquals(ErrorType.NOT_FOUND, errorOf(() -> fixture.accounting.removeOperatorDelegate(ADMIN, OD2)));
    }

    @Test
    void bufferRefillFromDelegate() {
        fixture.accounting.deposit(ALICE, STETH, ether(10), 0L);
        fixture.withdrawQueue.setBufferTarget(ADMIN, STETH, ether(4));
        assertEquals(ether(4), fixture.withdrawQueue.withdrawDeficit(STETH));

        RefillTicket ticket = fixture.accounting.initiateBufferRefill(ADMIN, STETH, ether(5));
        assertEquals(OD1, ticket.getDelegate());
        assertEquals(1, fixture.accounting.pendingRefills().size());
        // 未完成的取回仍计入 TVL
        assertEquals(ether(10), fixture.accounting.calculateTotalValues().getGrandTotal());

        BigInteger toBuffer = fixture.accounting.completeBufferRefill(ADMIN, OD1, ticket.getRequestId());

        assertEquals(ether(4), toBuffer);
        assertEquals(ether(4), fixture.withdrawQueue.availableToWithdraw(STETH));
        // 多出的 1 重新存回原委托
        assertEquals(ether(6), pool1.balanceOf(STETH));
        assertEquals(ether(10), fixture.accounting.calculateTotalValues().getGrandTotal());
        assertTrue(fixture.accounting.pendingRefills().isEmpty());
        assertEquals(ErrorType.NOT_FOUND,
                errorOf(() -> fixture.accounting.completeBufferRefill(ADMIN, OD1, ticket.getRequestId())));
    }

    @Test
    void failedRefillPlacementKeepsTicketAndValue() {
        fixture.accounting.deposit(ALICE, STETH, ether(10), 0L);
        fixture.withdrawQueue.setBufferTarget(ADMIN, STETH, ether(4));
        RefillTicket ticket = fixture.accounting.initiateBufferRefill(ADMIN, STETH, ether(5));
        Address core = fixture.accounting.getAddress();
        fixture.accessControl.revoke(core, Role.BUFFER_FILLER);

        assertEquals(ErrorType.NOT_AUTHORIZED,
                errorOf(() -> fixture.accounting.completeBufferRefill(ADMIN, OD1, ticket.getRequestId())));
        List<RefillTicket> pending = fixture.accounting.pendingRefills();
        assertEquals(1, pending.size());
        assertEquals(ether(5), pending.get(0).getReceived());
        // 已从池取出的资产停在核心地址，按在途价值计入 TVL
        assertEquals(ether(5), fixture.ledger.balanceOf(STETH, core));
        assertEquals(ether(5), pool1.balanceOf(STETH));
        TotalValues totals = fixture.accounting.calculateTotalValues();
        assertEquals(ether(5), totals.getRefillValue());
        assertEquals(ether(10), totals.getGrandTotal());

        // 恢复权限后重试，不再向池取回
        fixture.accessControl.grant(core, Role.BUFFER_FILLER);
        assertEquals(ether(4), fixture.accounting.completeBufferRefill(ADMIN, OD1, ticket.getRequestId()));
        assertEquals(ether(4), fixture.withdrawQueue.availableToWithdraw(STETH));
        assertEquals(ether(6), pool1.balanceOf(STETH));
        assertEquals(ether(6), fixture.ledger.balanceOf(STETH, OD1));
        assertEquals(BigInteger.ZERO, fixture.ledger.balanceOf(STETH, core));
        assertTrue(fixture.accounting.pendingRefills().isEmpty());
        assertEquals(ether(10), fixture.accounting.calculateTotalValues().getGrandTotal());
    }

    @Test
    void depositWithoutFillerRoleLeavesNoPoolBalance() {
        fixture.withdrawQueue.setBufferTarget(ADMIN, STETH, ether(4));
        fixture.accessControl.revoke(fixture.accounting.getAddress(), Role.BUFFER_FILLER);

        assertEquals(ErrorType.NOT_AUTHORIZED,
                errorOf(() -> fixture.accounting.deposit(ALICE, STETH, ether(10), 0L)));
        assertEquals(BigInteger.ZERO, pool1.balanceOf(STETH));
        assertEquals(BigInteger.ZERO, fixture.ledger.balanceOf(STETH, OD1));
        assertEquals(ether(1_000), fixture.ledger.balanceOf(STETH, ALICE));
        assertEquals(BigInteger.ZERO, fixture.shareToken.totalSupply());
        assertEquals(BigInteger.ZERO, fixture.accounting.calculateTotalValues().getGrandTotal());
    }

    @Test
    void rejectedPoolDepositRollsBackBufferAndShares() {
        RestakeFixture local = new RestakeFixture();
        local.addAsset(STETH, ETHER);
        MemoryOperatorPool rejecting = new MemoryOperatorPool(OD2, local.accounting.getAddress(), local.ledger) {
            @Override
            public synchronized BigInteger deposit(Address asset, BigInteger amount) {
                throw new IllegalStateException("strategy closed");
            }
        };
        local.accounting.addOperatorDelegate(ADMIN, OD2, rejecting, 10_000);
        local.withdrawQueue.setBufferTarget(ADMIN, STETH, ether(4));
        local.fund(STETH, ALICE, ether(10));

        assertThrows(IllegalStateException.class, () -> local.accounting.deposit(ALICE, STETH, ether(10), 0L));
        assertEquals(ether(10), local.ledger.balanceOf(STETH, ALICE));
        assertEquals(BigInteger.ZERO, local.ledger.balanceOf(STETH, OD2));
        assertEquals(BigInteger.ZERO, local.ledger.balanceOf(STETH, local.withdrawQueue.getAddress()));
        assertEquals(BigInteger.ZERO, local.withdrawQueue.bufferState(STETH).getBalance());
        assertEquals(BigInteger.ZERO, local.shareToken.balanceOf(ALICE));
        assertEquals(BigInteger.ZERO, local.shareToken.totalSupply());
        assertEquals(EventType.BUFFER_FILL_REVERTED, local.events.recent(1).get(0).getType());
    }

    @Test
    void reentrantDepositDuringClaimPayoutLeavesNoTrace() {
        HookedLedger ledger = new HookedLedger();
        RestakeFixture hooked = new RestakeFixture(ledger);
        hooked.addAsset(STETH, ETHER);
        MemoryOperatorPool pool = hooked.addDelegate(OD1, 10_000);
        hooked.fund(STETH, ALICE, ether(1_000));
        hooked.fund(STETH, BOB, ether(100));
        hooked.withdrawQueue.setBufferTarget(ADMIN, STETH, ether(10));
        hooked.accounting.deposit(BOB, STETH, ether(100), 0L);
        assertEquals(ether(90), pool.balanceOf(STETH));
        hooked.withdrawQueue.withdraw(BOB, ether(5), STETH);
        hooked.passCooldown();

        // 收款时用户再次存款，缓冲缺口会让存款回补正在结算的提现队列
        ErrorType[] nested = new ErrorType[1];
        ledger.onPayout(hooked.withdrawQueue.getAddress(), () -> {
            try {
                hooked.accounting.deposit(ALICE, STETH, ether(20), 0L);
            } catch (RestakeException e) {
                nested[0] = e.getErrorType();
            }
        });
        assertEquals(ether(5), hooked.withdrawQueue.claim(0, BOB).getAmount());
        ledger.onPayout(hooked.withdrawQueue.getAddress(), null);

        assertEquals(ErrorType.REENTRANT_CALL, nested[0]);
        assertEquals(ether(90), pool.balanceOf(STETH));
        assertEquals(ether(90), ledger.balanceOf(STETH, OD1));
        assertEquals(ether(1_000), ledger.balanceOf(STETH, ALICE));
        assertEquals(BigInteger.ZERO, hooked.shareToken.balanceOf(ALICE));
        assertEquals(ether(95), hooked.shareToken.totalSupply());
        assertEquals(ether(95), hooked.accounting.calculateTotalValues().getGrandTotal());
    }

    @Test
    void refillNeedsEligibleDelegate() {
        fixture.accounting.deposit(ALICE, STETH, ether(3), 0L);
        assertEquals(ErrorType.NO_ELIGIBLE_DELEGATE,
                errorOf(() -> fixture.accounting.initiateBufferRefill(ADMIN, STETH, ether(5))));
        assertEquals(ErrorType.NOT_AUTHORIZED,
                errorOf(() -> fixture.accounting.initiateBufferRefill(MALLORY, STETH, ether(1))));
    }
}
