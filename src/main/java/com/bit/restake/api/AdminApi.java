package com.bit.restake.api;

import com.bit.restake.accounting.AccountingService;
import com.bit.restake.accounting.DepositQueue;
import com.bit.restake.adapter.memory.MemoryOperatorPool;
import com.bit.restake.api.dto.AddAssetBody;
import com.bit.restake.common.Address;
import com.bit.restake.instant.InstantWithdrawer;
import com.bit.restake.oracle.PriceOracle;
import com.bit.restake.oracle.feed.BridgedPriceFeed;
import com.bit.restake.result.Result;
import com.bit.restake.structure.asset.CollateralAsset;
import com.bit.restake.structure.delegate.OperatorDelegate;
import com.bit.restake.structure.dto.RefillTicket;
import com.bit.restake.structure.instant.InstantWithdrawConfig;
import com.bit.restake.token.AssetLedger;
import com.bit.restake.withdraw.WithdrawQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

import static com.bit.restake.api.VaultApi.CALLER_HEADER;

/**
 * 管理入口，角色校验由各组件的 @RequiresRole 完成
 */
@Slf4j
@RestController
@RequestMapping("/admin")
public class AdminApi {

    @Autowired
    private AccountingService accountingService;

    @Autowired
    private WithdrawQueue withdrawQueue;

    @Autowired
    private DepositQueue depositQueue;

    @Autowired
    private InstantWithdrawer instantWithdrawer;

    @Autowired
    private PriceOracle priceOracle;

    @Autowired
    private BridgedPriceFeed bridgedPriceFeed;

    @Autowired
    private AssetLedger assetLedger;

    // ---------------- 资产与价格 ----------------

    //中继写入价格
    @PostMapping("/price")
    public Result<Void> updatePrice(@RequestHeader(CALLER_HEADER) Address caller, @RequestParam Address asset,
                                    @RequestParam BigInteger price, @RequestParam long timestamp) {
        bridgedPriceFeed.updatePrice(caller, asset, price, timestamp);
        return Result.OK();
    }

    //资产改用中继价格源
    @PostMapping("/priceFeed")
    public Result<Void> usePriceFeed(@RequestHeader(CALLER_HEADER) Address caller, @RequestParam Address asset) {
        priceOracle.setPriceFeed(caller, asset, bridgedPriceFeed);
        return Result.OK();
    }

    @PostMapping("/asset")
    public Result<List<CollateralAsset>> addAsset(@RequestHeader(CALLER_HEADER) Address caller,
                                                  @RequestBody AddAssetBody body) {
        accountingService.addCollateralAsset(caller, CollateralAsset.builder()
                .address(body.getAsset())
                .priceFeedRef(body.getPriceFeedRef())
                .decimals(body.getDecimals())
                .valueCap(body.getValueCap())
                .build());
        return Result.OK(accountingService.listCollateralAssets());
    }

    @DeleteMapping("/asset")
    public Result<List<CollateralAsset>> removeAsset(@RequestHeader(CALLER_HEADER) Address caller,
                                                     @RequestParam Address asset) {
        accountingService.removeCollateralAsset(caller, asset);
        return Result.OK(accountingService.listCollateralAssets());
    }

    @PostMapping("/asset/cap")
    public Result<Void> setAssetCap(@RequestHeader(CALLER_HEADER) Address caller, @RequestParam Address asset,
                                    @RequestParam BigInteger cap) {
        accountingService.setAssetValueCap(caller, asset, cap);
        return Result.OK();
    }

    @PostMapping("/maxTvl")
    public Result<Void> setMaxTvl(@RequestHeader(CALLER_HEADER) Address caller, @RequestParam BigInteger value) {
        accountingService.setMaxDepositTvl(caller, value);
        return Result.OK();
    }

    // ---------------- 运营商委托 ----------------

    //本地模式下用内存池作为运营商池
    @PostMapping("/delegate")
    public Result<List<OperatorDelegate>> addDelegate(@RequestHeader(CALLER_HEADER) Address caller,
                                                      @RequestParam Address delegate,
                                                      @RequestParam int allocationBps) {
        MemoryOperatorPool pool = new MemoryOperatorPool(delegate, accountingService.getAddress(), assetLedger);
        accountingService.addOperatorDelegate(caller, delegate, pool, allocationBps);
        return Result.OK(accountingService.listOperatorDelegates());
    }

    @DeleteMapping("/delegate")
    public Result<List<OperatorDelegate>> removeDelegate(@RequestHeader(CALLER_HEADER) Address caller,
                                                         @RequestParam Address delegate) {
        accountingService.removeOperatorDelegate(caller, delegate);
        return Result.OK(accountingService.listOperatorDelegates());
    }

    @PostMapping("/delegate/allocation")
    public Result<Void> setAllocation(@RequestHeader(CALLER_HEADER) Address caller, @RequestParam Address delegate,
                                      @RequestParam int allocationBps) {
        accountingService.setOperatorDelegateAllocation(caller, delegate, allocationBps);
        return Result.OK();
    }

    @PostMapping("/stakeNative")
    public Result<BigInteger> stakeNative(@RequestHeader(CALLER_HEADER) Address caller, @RequestParam Address delegate,
                                          @RequestParam int validators) {
        return Result.OK(depositQueue.stakeStagedNative(caller, delegate, validators));
    }

    @PostMapping("/refill/initiate")
    public Result<RefillTicket> initiateRefill(@RequestHeader(CALLER_HEADER) Address caller, @RequestParam Address asset,
                                               @RequestParam BigInteger amount) {
        return Result.OK(accountingService.initiateBufferRefill(caller, asset, amount));
    }

    @PostMapping("/refill/complete")
    public Result<BigInteger> completeRefill(@RequestHeader(CALLER_HEADER) Address caller,
                                             @RequestParam Address delegate, @RequestParam long requestId) {
        return Result.OK(accountingService.completeBufferRefill(caller, delegate, requestId));
    }

    // ---------------- 提现参数 ----------------

    @PostMapping("/bufferTarget")
    public Result<Void> setBufferTarget(@RequestHeader(CALLER_HEADER) Address caller, @RequestParam Address asset,
                                        @RequestParam BigInteger target) {
        withdrawQueue.setBufferTarget(caller, asset, target);
        return Result.OK();
    }

    @PostMapping("/cooldown")
    public Result<Void> setCooldown(@RequestHeader(CALLER_HEADER) Address caller, @RequestParam long seconds) {
        withdrawQueue.setCooldown(caller, seconds);
        return Result.OK();
    }

    @PostMapping("/instantConfig")
    public Result<InstantWithdrawConfig> setInstantConfig(@RequestHeader(CALLER_HEADER) Address caller,
                                                          @RequestBody InstantWithdrawConfig config) {
        instantWithdrawer.setConfig(caller, config);
        return Result.OK(instantWithdrawer.getConfig());
    }

    /**
     * @param target deposit / withdraw / instant
     */
    @PostMapping("/pause")
    public Result<Void> pause(@RequestHeader(CALLER_HEADER) Address caller, @RequestParam String target,
                              @RequestParam boolean paused) {
        switch (target) {
            case "deposit":
                accountingService.setPaused(caller, paused);
                break;
            case "withdraw":
                withdrawQueue.setPaused(caller, paused);
                break;
            case "instant":
                instantWithdrawer.setPaused(caller, paused);
                break;
            default:
                throw new IllegalArgumentException("未知暂停目标: " + target);
        }
        return Result.OK();
    }
}
