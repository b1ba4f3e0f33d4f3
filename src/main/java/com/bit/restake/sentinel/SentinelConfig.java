package com.bit.restake.sentinel;

import com.alibaba.csp.sentinel.annotation.aspectj.SentinelResourceAspect;
import com.alibaba.csp.sentinel.slots.block.RuleConstant;
import com.alibaba.csp.sentinel.slots.block.flow.FlowRule;
import com.alibaba.csp.sentinel.slots.block.flow.FlowRuleManager;
import com.bit.restake.config.RestakeConfig;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
public class SentinelConfig {

    private final RestakeConfig config;

    public SentinelConfig(RestakeConfig config) {
        this.config = config;
    }

    // 注册 Sentinel 注解切面，自动处理 @SentinelResource
    @Bean
    public SentinelResourceAspect sentinelResourceAspect() {
        return new SentinelResourceAspect();
    }

    /**
     * 限流规则来自配置，熔断规则由 {@link SentinelInit} 通过 SPI 加载
     */
    @PostConstruct
    public void initFlowRules() {
        RestakeConfig.RateLimit rateLimit = config.getRateLimit();
        List<FlowRule> rules = new ArrayList<>();
        rules.add(qpsRule("vault:deposit", rateLimit.getDepositQps()));
        rules.add(qpsRule("vault:withdraw", rateLimit.getWithdrawQps()));
        rules.add(qpsRule("vault:claim", rateLimit.getWithdrawQps()));
        rules.add(qpsRule("vault:instantWithdraw", rateLimit.getInstantWithdrawQps()));
        FlowRuleManager.loadRules(rules);
        log.info("initFlowRules {}", rateLimit);
    }

    static FlowRule qpsRule(String resource, double qps) {
        FlowRule rule = new FlowRule();
        // 资源名与 @SentinelResource 的 value 一致
        rule.setResource(resource);
        rule.setGrade(RuleConstant.FLOW_GRADE_QPS);
        rule.setCount(qps);
        return rule;
    }
}
