package com.bit.restake.api;

import com.alibaba.csp.sentinel.annotation.SentinelResource;
import com.alibaba.csp.sentinel.slots.block.BlockException;
import com.bit.restake.accounting.AccountingService;
import com.bit.restake.api.dto.DepositBody;
import com.bit.restake.api.dto.WithdrawBody;
import com.bit.restake.common.Address;
import com.bit.restake.exception.RestakeException;
import com.bit.restake.instant.InstantWithdrawer;
import com.bit.restake.result.Result;
import com.bit.restake.structure.buffer.BufferState;
import com.bit.restake.structure.dto.DepositReceipt;
import com.bit.restake.structure.dto.InstantWithdrawReceipt;
import com.bit.restake.structure.tvl.TotalValues;
import com.bit.restake.structure.withdraw.PendingPayout;
import com.bit.restake.structure.withdraw.WithdrawRequest;
import com.bit.restake.withdraw.WithdrawQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * 用户入口：存款、提现、领取、即时提现，以及只读视图
 * 调用方身份取自 X-Caller 请求头
 */
@Slf4j
@RestController
@RequestMapping("/vault")
public class VaultApi {

    public static final String CALLER_HEADER = "X-Caller";

    @Autowired
    private AccountingService accountingService;

    @Autowired
    private WithdrawQueue withdrawQueue;

    @Autowired
    private InstantWithdrawer instantWithdrawer;

    //存入抵押资产
    @PostMapping("/deposit")
    @SentinelResource(value = "vault:deposit", blockHandler = "depositBlocked",
            exceptionsToIgnore = RestakeException.class)
    public Result<DepositReceipt> deposit(@RequestHeader(CALLER_HEADER) Address caller, @RequestBody DepositBody body) {
        return Result.OK(accountingService.deposit(caller, body.getAsset(), body.getAmount(), body.getReferralId()));
    }

    //存入原生币
    @PostMapping("/depositNative")
    @SentinelResource(value = "vault:deposit", blockHandler = "depositBlocked",
            exceptionsToIgnore = RestakeException.class)
    public Result<DepositReceipt> depositNative(@RequestHeader(CALLER_HEADER) Address caller, @RequestBody DepositBody body) {
        return Result.OK(accountingService.depositNative(caller, body.getAmount(), body.getReferralId()));
    }

    //发起提现
    @PostMapping("/withdraw")
    @SentinelResource(value = "vault:withdraw", blockHandler = "withdrawBlocked",
            exceptionsToIgnore = RestakeException.class)
    public Result<WithdrawRequest> withdraw(@RequestHeader(CALLER_HEADER) Address caller, @RequestBody WithdrawBody body) {
        return Result.OK(withdrawQueue.withdraw(caller, body.getShares(), body.getAsset()));
    }

    //冷却期后领取
    @PostMapping("/claim")
    @SentinelResource(value = "vault:claim", blockHandler = "claimBlocked",
            exceptionsToIgnore = RestakeException.class)
    public Result<PendingPayout> claim(@RequestHeader(CALLER_HEADER) Address caller, @RequestParam int requestIndex) {
        return Result.OK(withdrawQueue.claim(requestIndex, caller));
    }

    //即时提现
    @PostMapping("/instantWithdraw")
    @SentinelResource(value = "vault:instantWithdraw", blockHandler = "instantWithdrawBlocked",
            exceptionsToIgnore = RestakeException.class)
    public Result<InstantWithdrawReceipt> instantWithdraw(@RequestHeader(CALLER_HEADER) Address caller,
                                                          @RequestBody WithdrawBody body) {
        return Result.OK(instantWithdrawer.withdraw(caller, body.getShares(), body.getAsset(), body.getMinOut()));
    }

    //回补缓冲（需 BUFFER_FILLER 角色）
    @PostMapping("/fillBuffer")
    public Result<BufferState> fillBuffer(@RequestHeader(CALLER_HEADER) Address caller, @RequestParam Address asset,
                                          @RequestParam BigInteger amount) {
        withdrawQueue.fillBuffer(caller, asset, amount);
        return Result.OK(withdrawQueue.bufferState(asset));
    }

    @GetMapping("/tvl")
    public Result<TotalValues> tvl() {
        return Result.OK(accountingService.calculateTotalValues());
    }

    @GetMapping("/available")
    public Result<BigInteger> available(@RequestParam Address asset) {
        return Result.OK(withdrawQueue.availableToWithdraw(asset));
    }

    @GetMapping("/deficit")
    public Result<BigInteger> deficit(@RequestParam Address asset) {
        return Result.OK(withdrawQueue.withdrawDeficit(asset));
    }

    @GetMapping("/quote")
    public Result<BigInteger> quote(@RequestParam Address asset, @RequestParam BigInteger shares) {
        return Result.OK(withdrawQueue.quoteRedeem(shares, asset));
    }

    @GetMapping("/quoteInstant")
    public Result<InstantWithdrawReceipt> quoteInstant(@RequestParam Address asset, @RequestParam BigInteger shares) {
        return Result.OK(instantWithdrawer.preview(shares, asset));
    }

    @GetMapping("/buffer")
    public Result<BufferState> buffer(@RequestParam Address asset) {
        return Result.OK(withdrawQueue.bufferState(asset));
    }

    @GetMapping("/requests")
    public Result<List<WithdrawRequest>> requests(@RequestHeader(CALLER_HEADER) Address caller) {
        return Result.OK(withdrawQueue.withdrawRequests(caller));
    }

    // 限流与阻塞处理
    public Result<DepositReceipt> depositBlocked(Address caller, DepositBody body, BlockException e) {
        log.warn("deposit blocked caller={} rule={}", caller, e.getRule());
        return Result.blocked("vault:deposit");
    }

    public Result<WithdrawRequest> withdrawBlocked(Address caller, WithdrawBody body, BlockException e) {
        log.warn("withdraw blocked caller={} rule={}", caller, e.getRule());
        return Result.blocked("vault:withdraw");
    }

    public Result<PendingPayout> claimBlocked(Address caller, int requestIndex, BlockException e) {
        log.warn("claim blocked caller={} rule={}", caller, e.getRule());
        return Result.blocked("vault:claim");
    }

    public Result<InstantWithdrawReceipt> instantWithdrawBlocked(Address caller, WithdrawBody body, BlockException e) {
        log.warn("instant withdraw blocked caller={} rule={}", caller, e.getRule());
        return Result.blocked("vault:instantWithdraw");
    }
}
