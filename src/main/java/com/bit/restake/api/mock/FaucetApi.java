package com.bit.restake.api.mock;

import com.bit.restake.adapter.memory.MemoryAssetLedger;
import com.bit.restake.common.Address;
import com.bit.restake.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * 本地联调：给地址发放资产
 */
@Slf4j
@RestController
@RequestMapping("/mock")
public class FaucetApi {

    @Autowired
    private MemoryAssetLedger assetLedger;

    @PostMapping("/faucet")
    public Result<BigInteger> faucet(@RequestParam Address asset, @RequestParam Address to,
                                     @RequestParam BigInteger amount) {
        assetLedger.mint(asset, to, amount);
        log.info("faucet {} {} -> {}", amount, asset, to);
        return Result.OK(assetLedger.balanceOf(asset, to));
    }

    @GetMapping("/balance")
    public Result<BigInteger> balance(@RequestParam Address asset, @RequestParam Address holder) {
        return Result.OK(assetLedger.balanceOf(asset, holder));
    }
}
