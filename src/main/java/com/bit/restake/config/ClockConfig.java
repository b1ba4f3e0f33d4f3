package com.bit.restake.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // 冷却期与价格时效统一使用该时钟
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
