package com.bit.restake;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.restake")
public class RestakeApplication {
    public static void main(String[] args) {
        long start = System.currentTimeMillis();
        SpringApplication.run(RestakeApplication.class, args);
        log.info("启动耗时{}ms", System.currentTimeMillis() - start);
    }
    //金额统一用 BigInteger，18位精度
}
