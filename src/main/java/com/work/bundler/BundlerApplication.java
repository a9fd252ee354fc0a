package com.work.bundler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口：启动后通过 POST /rpc 接收 UserOperation，按周期/阈值打包上链。
 */
@SpringBootApplication
public class BundlerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BundlerApplication.class, args);
    }
}
