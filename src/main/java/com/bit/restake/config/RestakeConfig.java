package com.bit.restake.config;

import com.bit.restake.common.Address;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "restake")
public class RestakeConfig {

    // 管理员地址，启动时授予全部管理角色
    private String admin = "0x00000000000000000000000000000000000000a1";

    // 各组件在账本中的托管地址
    private String accountingAddress = "0x00000000000000000000000000000000000000c1";
    private String withdrawQueueAddress = "0x00000000000000000000000000000000000000c2";
    private String depositQueueAddress = "0x00000000000000000000000000000000000000c3";
    private String instantWithdrawerAddress = "0x00000000000000000000000000000000000000c4";

    /**
     * 默认提现冷却期（秒），7天
     */
    private long cooldownSeconds = 7 * 24 * 60 * 60L;

    private InstantWithdraw instantWithdraw = new InstantWithdraw();

    private Bridge bridge = new Bridge();

    private RateLimit rateLimit = new RateLimit();

    // 最近事件缓存条数
    private int eventCacheSize = 10_000;

    @Data
    public static class InstantWithdraw {
        private int drawdownLimitBps = 2_000;   // 缓冲下限 = 目标 * 20%
        private int minFeeBps = 10;
        private int maxFeeBps = 100;
        private String feeDestination = "0x00000000000000000000000000000000000000fe";
    }

    @Data
    public static class Bridge {
        private int maxDeviationBps = 500;      // 部署相关 100~1000
    }

    @Data
    public static class RateLimit {
        private double depositQps = 50;
        private double withdrawQps = 50;
        private double instantWithdrawQps = 10;
    }

    public Address adminAddress() {
        return Address.fromHex(admin);
    }

    public Address accountingAddress() {
        return Address.fromHex(accountingAddress);
    }

    public Address withdrawQueueAddress() {
        return Address.fromHex(withdrawQueueAddress);
    }

    public Address depositQueueAddress() {
        return Address.fromHex(depositQueueAddress);
    }

    public Address instantWithdrawerAddress() {
        return Address.fromHex(instantWithdrawerAddress);
    }
}
