package com.bit.restake.sentinel;

import com.alibaba.csp.sentinel.init.InitFunc;
import com.alibaba.csp.sentinel.slots.block.RuleConstant;
import com.alibaba.csp.sentinel.slots.block.degrade.DegradeRule;
import com.alibaba.csp.sentinel.slots.block.degrade.DegradeRuleManager;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Sentinel 启动时通过 SPI 调用 init()
 * 业务异常（RestakeException）不计入熔断统计，只有适配层的意外失败才会触发
 */
@Slf4j
public class SentinelInit implements InitFunc {

    static final String[] GUARDED_RESOURCES = {
            "vault:deposit", "vault:withdraw", "vault:claim", "vault:instantWithdraw"
    };

    @Override
    public void init() throws Exception {
        DegradeRuleManager.loadRules(circuitBreakerRules());
        log.info("initCircuitBreakerRules");
    }

    static List<DegradeRule> circuitBreakerRules() {
        List<DegradeRule> rules = new ArrayList<>();
        for (String resource : GUARDED_RESOURCES) {
            DegradeRule rule = new DegradeRule();
            rule.setResource(resource);
            rule.setGrade(RuleConstant.DEGRADE_GRADE_EXCEPTION_COUNT); // 按异常次数熔断
            rule.setCount(5);
            rule.setTimeWindow(30); // 熔断时长（秒）
            rule.setStatIntervalMs(10_000);
            rule.setMinRequestAmount(5);
            rules.add(rule);
        }
        return rules;
    }
}
